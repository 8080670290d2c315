// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.fortran.java.symbols;

/** The categories of types: the five intrinsic categories and derived types. */
public enum TypeCategory {
  INTEGER,
  REAL,
  COMPLEX,
  CHARACTER,
  LOGICAL,
  DERIVED;

  /** Reports whether values of this category are numbers. */
  public boolean isNumeric() {
    return this == INTEGER || this == REAL || this == COMPLEX;
  }
}
