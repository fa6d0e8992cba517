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

package com.google.restyle.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A dotted module name such as {@code Foo.Bar.Baz}. Essentially a qualified name is a list of
 * {@linkplain #getComponent components}, starting from the root segment and ending with the last
 * segment, which is the name a local alias binds.
 */
public abstract class QualifiedName {

  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  // All subclasses must be defined in this file.
  private QualifiedName() {}

  public static QualifiedName of(String string) {
    ImmutableList<String> terms = ImmutableList.copyOf(DOT_SPLITTER.split(string));
    for (String term : terms) {
      checkArgument(!term.isEmpty(), "Malformed name: %s", string);
    }
    return new StringListQname(terms, terms.size());
  }

  public static QualifiedName of(Iterable<String> terms) {
    ImmutableList<String> list = ImmutableList.copyOf(terms);
    checkArgument(!list.isEmpty());
    return new StringListQname(list, list.size());
  }

  /** Returns the name spelled by an {@link Token#ALIASES} node. */
  public static QualifiedName fromAliases(Node aliases) {
    checkArgument(aliases.isAliases(), aliases);
    return of(aliases.getString());
  }

  /**
   * Returns the qualified name of the owner, or null for simple names. For the name "Foo.Bar.Baz",
   * this returns an object representing "Foo.Bar".
   */
  public abstract @Nullable QualifiedName getOwner();

  /**
   * Returns the last term of this qualified name, or the entire name for simple names. For the
   * name "Foo.Bar.Baz", this returns "Baz".
   */
  public abstract String getComponent();

  /** Appends the joined qualified name to the given StringBuilder. */
  abstract void appendTo(StringBuilder sb);

  /**
   * Returns the components of this name as a list of strings, starting at the root. For the
   * qualified name Foo.Bar.Baz, this returns ["Foo", "Bar", "Baz"].
   */
  public ImmutableList<String> components() {
    ImmutableList.Builder<String> components = ImmutableList.builder();
    buildComponents(components);
    return components.build();
  }

  private void buildComponents(ImmutableList.Builder<String> builder) {
    QualifiedName owner = getOwner();
    if (owner != null) {
      owner.buildComponents(builder);
    }
    builder.add(getComponent());
  }

  /** Returns the number of segments. */
  public int size() {
    return components().size();
  }

  /** Returns the root segment, "Foo" for "Foo.Bar.Baz". */
  public String getRoot() {
    return components().get(0);
  }

  /** Returns the qualified name as a string. */
  public String join() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  /**
   * Returns a new qualified name object with {@code this} name as the owner and the given string as
   * the last segment.
   */
  public QualifiedName getprop(String segment) {
    return new GetpropQname(this, segment);
  }

  /** Returns this name with every segment of {@code suffix} appended. */
  public QualifiedName append(Iterable<String> suffix) {
    QualifiedName result = this;
    for (String segment : suffix) {
      result = result.getprop(segment);
    }
    return result;
  }

  /** Whether {@code prefix} names this name or one of its owners. */
  public boolean startsWith(QualifiedName prefix) {
    ImmutableList<String> mine = components();
    ImmutableList<String> theirs = prefix.components();
    return theirs.size() <= mine.size() && mine.subList(0, theirs.size()).equals(theirs);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof QualifiedName && ((QualifiedName) o).join().equals(join());
  }

  @Override
  public int hashCode() {
    return join().hashCode();
  }

  @Override
  public String toString() {
    return join();
  }

  /** A qualified name based on a list of string terms. */
  private static class StringListQname extends QualifiedName {
    final ImmutableList<String> terms;
    final int size;

    StringListQname(ImmutableList<String> terms, int size) {
      this.terms = terms;
      this.size = size;
    }

    @Override
    public @Nullable QualifiedName getOwner() {
      return size > 1 ? new StringListQname(terms, size - 1) : null;
    }

    @Override
    public String getComponent() {
      return terms.get(size - 1);
    }

    @Override
    void appendTo(StringBuilder sb) {
      for (int i = 0; i < size; i++) {
        if (i > 0) {
          sb.append('.');
        }
        sb.append(terms.get(i));
      }
    }

    @Override
    public ImmutableList<String> components() {
      return terms.subList(0, size);
    }

    @Override
    public int size() {
      return size;
    }
  }

  /** A qualified name built with an extra segment on an existing qualified name. */
  private static class GetpropQname extends QualifiedName {
    final QualifiedName owner;
    final String prop;

    GetpropQname(QualifiedName owner, String prop) {
      checkArgument(!prop.isEmpty());
      this.owner = owner;
      this.prop = prop;
    }

    @Override
    public QualifiedName getOwner() {
      return owner;
    }

    @Override
    public String getComponent() {
      return prop;
    }

    @Override
    void appendTo(StringBuilder sb) {
      owner.appendTo(sb);
      sb.append('.').append(prop);
    }
  }
}
