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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

/**
 * LanguageOptions is the set of conformance options that affect semantic checking: how strictly
 * the standard is enforced and which extensions are reported. Several checks choose the severity
 * of a diagnostic, or whether to report it at all, from these options.
 *
 * <p>The {@link #DEFAULT} options accept the common extensions silently.
 */
@AutoValue
public abstract class LanguageOptions {

  /** The default options: extensions are accepted, and no warnings about them are reported. */
  public static final LanguageOptions DEFAULT = builder().build();

  /**
   * Report uses of extensions and obsolescent features as errors, and report as errors some
   * conditions, such as a DO step that is zero, that are otherwise warnings.
   */
  public abstract boolean strictConformance();

  /** Report all uses of extensions and obsolescent features as warnings. */
  public abstract boolean warnOnNonstandardUsage();

  /**
   * The features whose use is reported as a warning even when {@link #warnOnNonstandardUsage} is
   * false.
   */
  public abstract ImmutableSet<LanguageFeature> warnedFeatures();

  /** Reports whether a use of the given feature should be reported as a warning. */
  public boolean shouldWarn(LanguageFeature feature) {
    return warnOnNonstandardUsage() || warnedFeatures().contains(feature);
  }

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_LanguageOptions.Builder()
        .strictConformance(false)
        .warnOnNonstandardUsage(false);
  }

  public abstract Builder toBuilder();

  /** A builder for LanguageOptions. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder strictConformance(boolean value);

    public abstract Builder warnOnNonstandardUsage(boolean value);

    abstract ImmutableSet.Builder<LanguageFeature> warnedFeaturesBuilder();

    /** Adds a feature to {@link LanguageOptions#warnedFeatures}. */
    public Builder warn(LanguageFeature feature) {
      warnedFeaturesBuilder().add(feature);
      return this;
    }

    public abstract LanguageOptions build();
  }
}
