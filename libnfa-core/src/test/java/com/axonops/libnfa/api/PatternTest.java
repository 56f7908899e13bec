/*
 * Copyright 2025 AxonOps
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

package com.axonops.libnfa.api;

import static org.assertj.core.api.Assertions.*;

import com.axonops.libnfa.cache.NfaConfig;
import com.axonops.libnfa.cache.PatternCache;
import com.axonops.libnfa.test.TestUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class PatternTest {

  private PatternCache originalCache;

  @BeforeEach
  void setup() {
    originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());
  }

  @AfterEach
  void cleanup() {
    TestUtils.restoreGlobalCache(originalCache);
  }

  // ===== Matcher =====

  @Test
  void testMatcherCarriesPatternAndInput() {
    Pattern p = Pattern.compile("[0-9]+");
    Matcher m = p.matcher("123");

    assertThat(m.pattern()).isSameAs(p);
    assertThat(m.input()).isEqualTo("123");
    assertThat(m.matches()).isTrue();
  }

  @Test
  void testMatcherRequiresInput() {
    Pattern p = Pattern.compile("x");
    assertThatThrownBy(() -> p.matcher(null))
        .isInstanceOf(InputRequiredException.class)
        .hasMessage("NFA: Input required: matcher input cannot be null");
  }

  @Test
  void testEmptyStringIsValidInput() {
    assertThat(Pattern.compile("x*").matches("")).isTrue();
    assertThat(Pattern.compile("x").matches("")).isFalse();
  }

  @Test
  void testAccessors() {
    Pattern p = Pattern.compile("ab*");

    assertThat(p.pattern()).isEqualTo("ab*");
    assertThat(p.stateCount()).isEqualTo(4);
    assertThat(p.graph().size()).isEqualTo(4);
    assertThat(p).hasToString("Pattern{ab*}");
  }

  // ===== Caching =====

  @Test
  void testCompileReusesCachedPattern() {
    Pattern first = Pattern.compile("[a-z]+");
    Pattern second = Pattern.compile("[a-z]+");

    assertThat(second).isSameAs(first);
    assertThat(Pattern.getCacheStatistics().hits()).isEqualTo(1);
    assertThat(Pattern.getCacheStatistics().misses()).isEqualTo(1);
  }

  @Test
  void testCompileWithoutCacheBuildsNewPattern() {
    Pattern cached = Pattern.compile("abc");
    Pattern uncached = Pattern.compileWithoutCache("abc");

    assertThat(uncached).isNotSameAs(cached);
    assertThat(Pattern.getCacheStatistics().totalRequests()).isEqualTo(1);
  }

  @Test
  void testInvalidPatternNotCached() {
    assertThatThrownBy(() -> Pattern.compile("[abc")).isInstanceOf(PatternCompilationException.class);
    assertThatThrownBy(() -> Pattern.compile("[abc")).isInstanceOf(PatternCompilationException.class);

    assertThat(Pattern.getCacheStatistics().currentSize()).isZero();
    assertThat(Pattern.getCacheStatistics().misses()).isEqualTo(2);
  }

  @Test
  void testClearAndResetCache() {
    Pattern.compile("a");
    Pattern.compile("b");
    assertThat(Pattern.getCacheStatistics().currentSize()).isEqualTo(2);

    Pattern.clearCache();
    assertThat(Pattern.getCacheStatistics().currentSize()).isZero();
    assertThat(Pattern.getCacheStatistics().misses()).isEqualTo(2);

    Pattern.resetCache();
    assertThat(Pattern.getCacheStatistics().misses()).isZero();
  }

  @Test
  void testConfigureCache() {
    NfaConfig config = TestUtils.testConfigBuilder().maxCacheSize(2).build();
    Pattern.configureCache(config);

    assertThat(Pattern.getCacheConfig()).isEqualTo(config);

    Pattern.compile("a");
    Pattern.compile("b");
    Pattern.compile("c");
    assertThat(Pattern.getCacheStatistics().currentSize()).isEqualTo(2);
    assertThat(Pattern.getCacheStatistics().evictions()).isEqualTo(1);
  }

  @Test
  void testDisabledCacheCompilesEveryTime() {
    Pattern.configureCache(NfaConfig.NO_CACHE);

    assertThat(Pattern.compile("a")).isNotSameAs(Pattern.compile("a"));
    assertThat(Pattern.getCacheStatistics().currentSize()).isZero();
  }

  // ===== Bulk Operations =====

  @Test
  void testMatchAllArray() {
    Pattern p = Pattern.compile("[0-9]+");
    boolean[] results = p.matchAll(new String[] {"1", "", "12a", "999"});

    assertThat(results).containsExactly(true, false, false, true);
  }

  @Test
  void testMatchAllEmpty() {
    Pattern p = Pattern.compile("x");
    assertThat(p.matchAll(new String[0])).isEmpty();
    assertThat(p.matchAll(List.of())).isEmpty();
  }

  @Test
  void testFilterKeepsOrderAndDuplicates() {
    Pattern p = Pattern.compile("a+");
    List<String> inputs = Arrays.asList("a", "b", "aa", "a", "ab");

    assertThat(p.filter(inputs)).containsExactly("a", "aa", "a");
    assertThat(p.filterNot(inputs)).containsExactly("b", "ab");
  }

  @Test
  void testBulkRejectsNullElements() {
    Pattern p = Pattern.compile("a");

    assertThatThrownBy(() -> p.matchAll(new String[] {"a", null}))
        .isInstanceOf(InputRequiredException.class)
        .hasMessageContaining("index 1");
    assertThatThrownBy(() -> p.filter(Arrays.asList(null, "a")))
        .isInstanceOf(InputRequiredException.class)
        .hasMessageContaining("index 0");
  }

  @Test
  void testBulkRejectsNullCollection() {
    Pattern p = Pattern.compile("a");

    assertThatThrownBy(() -> p.matchAll((String[]) null)).isInstanceOf(InputRequiredException.class);
    assertThatThrownBy(() -> p.matchAll((List<String>) null))
        .isInstanceOf(InputRequiredException.class);
    assertThatThrownBy(() -> p.filterNot(null)).isInstanceOf(InputRequiredException.class);
  }

  // ===== Thread Safety =====

  @Test
  @Timeout(30)
  void testSharedPatternAcrossThreads() throws Exception {
    Pattern shared = Pattern.compile("[a-z]+[0-9]*");
    int threads = 8;
    CountDownLatch startLatch = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        futures.add(
            executor.submit(
                () -> {
                  startLatch.await();
                  int correct = 0;
                  for (int i = 0; i < 1000; i++) {
                    if (shared.matches("abc" + i) && !shared.matches(i + "abc")) {
                      correct++;
                    }
                  }
                  return correct;
                }));
      }
      startLatch.countDown();

      for (Future<Integer> future : futures) {
        assertThat(future.get(20, TimeUnit.SECONDS)).isEqualTo(1000);
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
