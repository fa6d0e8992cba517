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

/** Thrown when a style fails on a file. The file must be left as it was. */
public class StyleException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String fileName;
  private final String styleName;

  public StyleException(String fileName, String styleName, Throwable cause) {
    super("INTERNAL REWRITE ERROR.\nPlease report this problem.\n\n"
        + "Style " + styleName + " failed on " + fileName + ": " + cause, cause);
    this.fileName = fileName;
    this.styleName = styleName;
  }

  public String getFileName() {
    return fileName;
  }

  public String getStyleName() {
    return styleName;
  }
}
