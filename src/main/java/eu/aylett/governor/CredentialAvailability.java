/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.governor;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Treats an upstream as available when the environment holds a credential for
 * its identity.
 * <p>
 * Keyless identities (local model servers) are always available. Identities
 * this instance knows nothing about never are.
 * </p>
 */
public final class CredentialAvailability implements UpstreamAvailability {
  private static final ImmutableMap<String, String> PROVIDER_KEYS = ImmutableMap.<String, String>builder()
      .put("openrouter", "OPENROUTER_API_KEY")
      .put("groq", "GROQ_API_KEY")
      .put("openai", "OPENAI_API_KEY")
      .put("anthropic", "ANTHROPIC_API_KEY")
      .put("together", "TOGETHER_API_KEY")
      .put("deepseek", "DEEPSEEK_API_KEY")
      .buildOrThrow();
  private static final ImmutableSet<String> KEYLESS_PROVIDERS = ImmutableSet.of("ollama");

  private final ImmutableMap<String, String> credentialVariables;
  private final ImmutableSet<String> keyless;
  private final Function<String, @Nullable String> environment;

  /**
   * @param credentialVariables
   *          identity to the name of the variable holding its credential
   * @param keyless
   *          identities that need no credential
   * @param environment
   *          variable lookup (mainly for testing)
   */
  public CredentialAvailability(Map<String, String> credentialVariables, Set<String> keyless,
      Function<String, @Nullable String> environment) {
    this.credentialVariables = ImmutableMap.copyOf(credentialVariables);
    this.keyless = ImmutableSet.copyOf(keyless);
    this.environment = environment;
  }

  /**
   * The LLM providers we know about, looked up in the process environment.
   */
  public static CredentialAvailability llmProviders() {
    return llmProviders(System::getenv);
  }

  public static CredentialAvailability llmProviders(Function<String, @Nullable String> environment) {
    return new CredentialAvailability(PROVIDER_KEYS, KEYLESS_PROVIDERS, environment);
  }

  @Override
  public boolean isAvailable(Upstream upstream) {
    var identity = upstream.identity();
    if (keyless.contains(identity)) {
      return true;
    }
    var variable = credentialVariables.get(identity);
    if (variable == null) {
      return false;
    }
    var value = environment.apply(variable);
    return value != null && !value.isBlank();
  }
}
