/*
 * Copyright 2025 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.restyle.rewrite;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.SetMultimap;
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.IR;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.QualifiedName;
import com.google.restyle.ast.Zipper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Hoists module names that are spelled out in full again and again into {@code alias} directives,
 * and shortens their uses.
 *
 * <p>A scope is the body of a top-level {@code defmodule}, or the whole file when it defines no
 * module. Module names nested inside a scope are counted with it. A name is hoisted when it is long
 * enough, used often enough, not excluded, and its last segment would not clash with any other
 * name visible in the scope. Only code after the new directive is rewritten.
 *
 * <p>The whole file is handled on the first visit, after which the traversal halts.
 */
final class AliasLifting implements Style {

  private static final Logger logger = Logger.getLogger(AliasLifting.class.getName());

  /** Module names are never shorter than this when hoisted. */
  private static final int MIN_SEGMENTS = 3;

  @Override
  public StyleResult run(Zipper zipper, StyleContext context) {
    if (!context.getOptions().getLiftAlias() || !zipper.node().isScript()) {
      return StyleResult.halt(zipper, context);
    }
    Node script = zipper.node();
    List<Integer> modules = new ArrayList<>();
    for (int i = 0; i < script.getChildCount(); i++) {
      Node statement = script.getChildAtIndex(i);
      if (NodeUtil.isDefmodule(statement) && NodeUtil.getDoBody(statement) != null) {
        modules.add(i);
      }
    }

    if (modules.isEmpty()) {
      StyleResult result = liftScope(zipper, null, context);
      return StyleResult.halt(result.getZipper().top(), result.getContext());
    }
    // Later scopes first, so that inserted lines never move a scope still to be handled.
    Zipper root = zipper;
    for (int m = modules.size() - 1; m >= 0; m--) {
      Zipper module = root.down();
      for (int i = 0; i < modules.get(m); i++) {
        module = module.right();
      }
      Node name = NodeUtil.getFirstArg(module.node());
      StyleResult result =
          liftScope(
              moveToBody(module),
              name != null && name.isAliases() ? QualifiedName.fromAliases(name) : null,
              context);
      root = result.getZipper().top();
      context = result.getContext();
    }
    return StyleResult.halt(root, context);
  }

  private static Zipper moveToBody(Zipper module) {
    for (Zipper child = module.down(); child != null; child = child.right()) {
      if (child.node().isDoBlock() && child.node().hasString("do")) {
        return child.down();
      }
    }
    throw new IllegalStateException("No do block in " + module.node());
  }

  /** What a scope binds and uses. */
  private static final class Scope {
    /** Short names bound by {@code alias}, with or without {@code as:}. */
    final Map<String, QualifiedName> aliasBindings = new HashMap<>();
    /** Short names of plain aliases bound exactly once; usages expand through these. */
    final Map<String, QualifiedName> plainAliases = new HashMap<>();
    /** First segments of nested module definitions, bound to the nested module. */
    final Map<String, QualifiedName> submodules = new HashMap<>();
    /** Short names bound by {@code alias} inside nested modules or function bodies. */
    final SetMultimap<String, QualifiedName> nestedBindings = HashMultimap.create();
    final List<QualifiedName> aliasTargets = new ArrayList<>();
    final List<Node> usages = new ArrayList<>();

    QualifiedName expand(QualifiedName name) {
      QualifiedName target = plainAliases.get(name.getRoot());
      if (target == null) {
        return name;
      }
      return target.append(name.components().subList(1, name.size()));
    }
  }

  private StyleResult liftScope(
      Zipper body, @Nullable QualifiedName moduleName, StyleContext context) {
    RewriteOptions options = context.getOptions();
    Scope scope = analyze(body.node(), moduleName);

    Multiset<QualifiedName> counts = LinkedHashMultiset.create();
    for (Node usage : scope.usages) {
      counts.add(scope.expand(QualifiedName.fromAliases(usage)));
    }

    List<QualifiedName> lifted = new ArrayList<>();
    Set<String> takenShortNames = new HashSet<>();
    for (Multiset.Entry<QualifiedName> entry : counts.entrySet()) {
      QualifiedName candidate = entry.getElement();
      if (entry.getCount() < options.getLiftAliasFrequency()
          || !isLiftable(candidate, scope, options)
          || takenShortNames.contains(candidate.getComponent())) {
        continue;
      }
      takenShortNames.add(candidate.getComponent());
      if (!candidate.equals(scope.aliasBindings.get(candidate.getComponent()))) {
        lifted.add(candidate);
      }
    }

    ImmutableList<Comment> comments = context.getComments();
    Set<Node> inserted = new HashSet<>();
    lifted.sort(Comparator.comparing(QualifiedName::join, aliasOrder(options)));
    for (QualifiedName name : lifted) {
      ImmutableList<Node> statements = body.node().children();
      int index = insertionIndex(statements, name, options);
      int line = insertionLine(statements, index, body.node(), comments);

      Node directive = IR.directive("alias", name.join(), line);
      inserted.add(directive);
      List<Node> newStatements =
          new ArrayList<>(body.node().shiftLinesAfter(line - 1, 1).children());
      newStatements.add(index, directive);
      Node newBody =
          body.node()
              .withChildren(newStatements)
              .withLineno(Math.min(body.node().getLineno(), line));
      body = body.replace(newBody).shiftLinesAfter(line - 1, 1);
      comments = Comments.shiftAfter(comments, line - 1, 1);
      logger.fine("Lifted alias " + name + " in " + context.getFileName());
    }

    if (lifted.isEmpty() && scope.plainAliases.isEmpty()) {
      return StyleResult.cont(body, context.withComments(comments));
    }
    return StyleResult.cont(
        body.replace(shortenUsages(body.node(), scope, inserted)),
        context.withComments(comments));
  }

  // Analysis.

  private static Scope analyze(Node body, @Nullable QualifiedName moduleName) {
    Scope scope = new Scope();
    Multiset<String> shortNames = LinkedHashMultiset.create();
    for (Node statement : body.children()) {
      if (!"alias".equals(NodeUtil.getDirectiveKind(statement))) {
        continue;
      }
      QualifiedName target = QualifiedName.fromAliases(NodeUtil.getFirstArg(statement));
      scope.aliasTargets.add(target);
      Node as = NodeUtil.getAliasAs(statement);
      if (as == null) {
        scope.aliasBindings.put(target.getComponent(), target);
        shortNames.add(target.getComponent());
      } else if (as.isAliases()) {
        scope.aliasBindings.put(as.getString(), target);
        shortNames.add(as.getString());
      }
    }
    for (Node statement : body.children()) {
      if (!"alias".equals(NodeUtil.getDirectiveKind(statement))) {
        collect(statement, moduleName, scope);
      }
    }
    for (Node statement : body.children()) {
      if ("alias".equals(NodeUtil.getDirectiveKind(statement))
          && NodeUtil.getAliasAs(statement) == null) {
        QualifiedName target = QualifiedName.fromAliases(NodeUtil.getFirstArg(statement));
        String shortName = target.getComponent();
        if (shortNames.count(shortName) == 1 && !scope.submodules.containsKey(shortName)) {
          scope.plainAliases.put(shortName, target);
        }
      }
    }
    return scope;
  }

  /** Collects the module names used under {@code n} and the modules it defines. */
  private static void collect(Node n, @Nullable QualifiedName moduleName, Scope scope) {
    if (n.isLocalCall("quote")) {
      return;
    }
    if (NodeUtil.getDirectiveKind(n) != null && n.isLocalCall("alias")) {
      recordNestedBinding(n, scope);
      return;
    }
    if (NodeUtil.isModuleDefinition(n)) {
      Node name = NodeUtil.getFirstArg(n);
      if (!n.isLocalCall("defimpl") && name != null && name.isAliases()) {
        String root = QualifiedName.fromAliases(name).getRoot();
        scope.submodules.put(
            root, moduleName == null ? QualifiedName.of(root) : moduleName.getprop(root));
      }
      for (Node block : NodeUtil.getDoBlocks(n)) {
        collect(block, moduleName, scope);
      }
      return;
    }
    if (n.isAliases()) {
      scope.usages.add(n);
      return;
    }
    for (Node child : n.children()) {
      collect(child, moduleName, scope);
    }
  }

  private static void recordNestedBinding(Node directive, Scope scope) {
    Node target = NodeUtil.getFirstArg(directive);
    if (target == null || !target.isAliases()) {
      return;
    }
    QualifiedName name = QualifiedName.fromAliases(target);
    Node as = NodeUtil.getAliasAs(directive);
    if (as == null) {
      scope.nestedBindings.put(name.getComponent(), name);
    } else if (as.isAliases()) {
      scope.nestedBindings.put(as.getString(), name);
    }
  }

  private static boolean isLiftable(QualifiedName candidate, Scope scope, RewriteOptions options) {
    String lastName = candidate.getComponent();
    if (candidate.size() < MIN_SEGMENTS
        || candidate.size() < options.getLiftAliasDepth()
        || options.getLiftAliasExcludedLastnames().contains(lastName)
        || options.getLiftAliasExcludedNamespaces().contains(candidate.getRoot())
        || scope.submodules.containsKey(candidate.getRoot())) {
      return false;
    }
    QualifiedName bound = scope.aliasBindings.get(lastName);
    if (bound != null && !bound.equals(candidate)) {
      return false;
    }
    if (scope.submodules.containsKey(lastName)) {
      return false;
    }
    // An inner alias would shadow the hoisted one wherever it is in effect.
    for (QualifiedName inner : scope.nestedBindings.get(lastName)) {
      if (!inner.equals(candidate)) {
        return false;
      }
    }
    // The short name must not already start some other module name in the scope.
    for (Node usage : scope.usages) {
      QualifiedName raw = QualifiedName.fromAliases(usage);
      if (raw.getRoot().equals(lastName) && !scope.expand(raw).startsWith(candidate)) {
        return false;
      }
    }
    for (QualifiedName target : scope.aliasTargets) {
      if (target.getRoot().equals(lastName) && !target.startsWith(candidate)) {
        return false;
      }
    }
    return true;
  }

  // Insertion.

  private static Comparator<String> aliasOrder(RewriteOptions options) {
    if (options.getSortOrder() == RewriteOptions.SortOrder.ASCII) {
      return Comparator.naturalOrder();
    }
    return String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());
  }

  private static int insertionIndex(
      ImmutableList<Node> statements, QualifiedName name, RewriteOptions options) {
    Comparator<String> order = aliasOrder(options);
    int lastAlias = -1;
    for (int i = 0; i < statements.size(); i++) {
      if ("alias".equals(NodeUtil.getDirectiveKind(statements.get(i)))) {
        String existing = NodeUtil.getFirstArg(statements.get(i)).getString();
        if (order.compare(existing, name.join()) > 0) {
          return i;
        }
        lastAlias = i;
      }
    }
    if (lastAlias >= 0) {
      return lastAlias + 1;
    }

    ImmutableList<String> layout = options.getStrictModuleLayoutOrder();
    int aliasRank = layout.indexOf("alias");
    int index = 0;
    for (int i = 0; i < statements.size(); i++) {
      String kind = NodeUtil.getDirectiveKind(statements.get(i));
      if (kind == null) {
        break;
      }
      if (layout.indexOf(kind) < aliasRank) {
        index = i + 1;
      }
    }
    return index;
  }

  /** The new directive takes the line of the statement it precedes, above its comments. */
  private static int insertionLine(
      ImmutableList<Node> statements, int index, Node body, ImmutableList<Comment> comments) {
    if (index >= statements.size()) {
      return statements.isEmpty()
          ? body.getLineno()
          : statements.get(statements.size() - 1).getMaxLine() + 1;
    }
    int line = statements.get(index).getLineno();
    ImmutableList<Comment> attached = Comments.commentsForLines(comments, line, line);
    return attached.isEmpty() ? line : Math.min(line, attached.get(0).getLine());
  }

  // Rewriting.

  private static Node shortenUsages(Node body, Scope scope, Set<Node> inserted) {
    Map<QualifiedName, String> visible = new LinkedHashMap<>();
    List<Node> statements = new ArrayList<>(body.getChildCount());
    for (Node statement : body.children()) {
      if (inserted.contains(statement)) {
        QualifiedName target = QualifiedName.fromAliases(NodeUtil.getFirstArg(statement));
        visible.put(target, target.getComponent());
        statements.add(statement);
      } else if ("alias".equals(NodeUtil.getDirectiveKind(statement))) {
        QualifiedName target = QualifiedName.fromAliases(NodeUtil.getFirstArg(statement));
        if (target.equals(scope.plainAliases.get(target.getComponent()))) {
          visible.put(target, target.getComponent());
        }
        statements.add(statement);
      } else {
        statements.add(shorten(statement, scope, ImmutableMap.copyOf(visible)));
      }
    }
    return body.withChildren(statements);
  }

  private static Node shorten(Node n, Scope scope, ImmutableMap<QualifiedName, String> visible) {
    if (visible.isEmpty()
        || n.isLocalCall("quote")
        || (NodeUtil.getDirectiveKind(n) != null && n.isLocalCall("alias"))) {
      return n;
    }
    if (n.isAliases()) {
      return shortenName(n, scope, visible);
    }
    Node result = n;
    boolean isModuleDefinition = NodeUtil.isModuleDefinition(n);
    for (int i = 0; i < n.getChildCount(); i++) {
      Node child = n.getChildAtIndex(i);
      if (isModuleDefinition && !child.isDoBlock()) {
        continue;
      }
      result = result.withChildAtIndex(i, shorten(child, scope, visible));
    }
    return result;
  }

  private static Node shortenName(
      Node aliases, Scope scope, ImmutableMap<QualifiedName, String> visible) {
    QualifiedName raw = QualifiedName.fromAliases(aliases);
    if (scope.submodules.containsKey(raw.getRoot())) {
      return aliases;
    }
    QualifiedName expanded = scope.expand(raw);
    for (QualifiedName prefix = expanded; prefix != null; prefix = prefix.getOwner()) {
      String shortName = visible.get(prefix);
      if (shortName != null) {
        QualifiedName result =
            QualifiedName.of(shortName)
                .append(expanded.components().subList(prefix.size(), expanded.size()));
        return result.size() < raw.size() ? aliases.withString(result.join()) : aliases;
      }
    }
    return aliases;
  }
}
