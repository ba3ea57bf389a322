package com.codeflow.core.frontend;

import com.codeflow.core.frontend.impl.c.CFrontend;
import com.codeflow.core.frontend.impl.java.JavaFrontend;
import com.codeflow.core.frontend.impl.python.PythonFrontend;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shares one front-end instance between threads and checks every thread gets the output
 * a single caller gets.
 */
class FrontendConcurrencyTest {

    private static final int THREADS = 8;
    private static final int CALLS_PER_THREAD = 25;

    static Stream<Arguments> frontends() {
        return Stream.of(
            Arguments.of(new CFrontend(), """
                int main() {
                    int n = 0;
                    while (n < 3) {
                        if (n % 2 == 0) { printf("even"); } else { printf("odd"); }
                        n++;
                    }
                    switch (n) { case 3: puts("three"); break; default: puts("other"); }
                    return 0;
                }
                """),
            Arguments.of(new JavaFrontend(), """
                public class Main {
                    public static void main(String[] args) {
                        for (int i = 0; i < 3; i++) {
                            System.out.println("tick");
                        }
                        do { i--; } while (i > 0);
                    }
                }
                """),
            Arguments.of(new PythonFrontend(), """
                n = int(input("n: "))
                while n > 0:
                    if n > 5:
                        print("big")
                    elif n > 2:
                        print("medium")
                    else:
                        print("small")
                    n -= 1
                """)
        );
    }

    @ParameterizedTest
    @MethodSource("frontends")
    void renderFlowchart_sharedAcrossThreads_matchesSingleThreadedOutput(LanguageFrontend frontend, String source)
            throws Exception {
        String expectedFlowchart = frontend.renderFlowchart(source);
        String expectedExplanation = frontend.explain(source);

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch ready = new CountDownLatch(THREADS);
        try {
            List<Future<List<String>>> results = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                Callable<List<String>> task = () -> {
                    ready.countDown();
                    ready.await(5, TimeUnit.SECONDS);
                    List<String> outputs = new ArrayList<>();
                    for (int i = 0; i < CALLS_PER_THREAD; i++) {
                        outputs.add(frontend.renderFlowchart(source));
                        outputs.add(frontend.explain(source));
                    }
                    return outputs;
                };
                results.add(executor.submit(task));
            }

            for (Future<List<String>> result : results) {
                List<String> outputs = result.get(30, TimeUnit.SECONDS);
                for (int i = 0; i < outputs.size(); i += 2) {
                    assertThat(outputs.get(i)).isEqualTo(expectedFlowchart);
                    assertThat(outputs.get(i + 1)).isEqualTo(expectedExplanation);
                }
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(expectedFlowchart).doesNotContain("Error:");
    }
}
