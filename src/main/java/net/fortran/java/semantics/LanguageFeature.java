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

package net.fortran.java.semantics;

/**
 * Extensions and obsolescent features that are accepted, but whose use can be reported as a
 * warning. See {@link LanguageOptions#warnedFeatures}.
 */
public enum LanguageFeature {
  /** DO variables and DO limits of type REAL. */
  REAL_DO_CONTROLS,
  /** Nested label DO loops that end on the same labeled statement. */
  SHARED_DO_TERMINATION;
}
