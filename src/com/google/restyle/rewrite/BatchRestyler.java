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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Restyles many files in parallel with one shared {@link RewriteOptions}. Each file is rewritten
 * sequentially on one thread; a file that fails is reported in its {@link FileOutcome} and does not
 * affect the others.
 */
public final class BatchRestyler {

  private static final Logger logger = Logger.getLogger(BatchRestyler.class.getName());

  private final Restyler restyler;
  private final int numParallelThreads;

  public BatchRestyler(RewriteOptions options, int numParallelThreads) {
    checkArgument(numParallelThreads > 0, "Need at least one thread: %s", numParallelThreads);
    this.restyler = new Restyler(options);
    this.numParallelThreads = numParallelThreads;
  }

  /** One parsed file. */
  @AutoValue
  public abstract static class SourceFile {
    public abstract String getFileName();

    public abstract Node getRoot();

    public abstract ImmutableList<Comment> getComments();

    public static SourceFile create(String fileName, Node root, List<Comment> comments) {
      return new AutoValue_BatchRestyler_SourceFile(
          fileName, root, ImmutableList.copyOf(comments));
    }
  }

  /** The result of restyling one file: either a rewritten file or the failure. */
  @AutoValue
  public abstract static class FileOutcome {
    public abstract String getFileName();

    public abstract @Nullable RewriteResult getResult();

    public abstract @Nullable StyleException getError();

    /** Whether the file was skipped because the options exclude its path. */
    public abstract boolean isSkipped();

    public boolean isSuccess() {
      return getResult() != null;
    }

    static FileOutcome success(String fileName, RewriteResult result) {
      return new AutoValue_BatchRestyler_FileOutcome(fileName, result, null, false);
    }

    static FileOutcome failure(String fileName, StyleException error) {
      return new AutoValue_BatchRestyler_FileOutcome(fileName, null, error, false);
    }

    static FileOutcome skipped(String fileName) {
      return new AutoValue_BatchRestyler_FileOutcome(fileName, null, null, true);
    }
  }

  /**
   * Restyles every file in {@code files} and returns their outcomes in the same order. Files whose
   * path the options do not allow are skipped.
   */
  public ImmutableList<FileOutcome> restyleAll(List<SourceFile> files) {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "restyle-BatchRestyler");
            t.setDaemon(true);
            return t;
          }
        };
    ThreadPoolExecutor poolExecutor =
        new ThreadPoolExecutor(
            numParallelThreads,
            numParallelThreads,
            Integer.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            threadFactory);
    ListeningExecutorService executorService = MoreExecutors.listeningDecorator(poolExecutor);
    List<ListenableFuture<FileOutcome>> futureList = new ArrayList<>(files.size());
    for (SourceFile file : files) {
      futureList.add(executorService.submit(() -> restyle(file)));
    }

    poolExecutor.shutdown();
    try {
      return ImmutableList.copyOf(Futures.allAsList(futureList).get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while restyling", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Unexpected failure while restyling", e.getCause());
    }
  }

  private FileOutcome restyle(SourceFile file) {
    if (!restyler.getOptions().isAllowedPath(file.getFileName())) {
      logger.fine("Skipping " + file.getFileName());
      return FileOutcome.skipped(file.getFileName());
    }
    try {
      return FileOutcome.success(
          file.getFileName(),
          restyler.rewrite(file.getFileName(), file.getRoot(), file.getComments()));
    } catch (StyleException e) {
      return FileOutcome.failure(file.getFileName(), e);
    }
  }
}
