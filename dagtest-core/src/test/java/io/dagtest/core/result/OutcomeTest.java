package io.dagtest.core.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class OutcomeTest {

    @Test
    void shouldPassNormalCompletionWithoutExpectations() {
        assertThat(Outcome.classify(null, ExpectedExceptions.none())).isEqualTo(Outcome.PASS);
    }

    @Test
    void shouldFailNormalCompletionWhenExceptionExpected() {
        ExpectedExceptions expected = ExpectedExceptions.of(IOException.class);

        assertThat(Outcome.classify(null, expected)).isEqualTo(Outcome.FAIL);
        assertThat(Outcome.classify(null, expected.orNormalCompletion())).isEqualTo(Outcome.PASS);
    }

    @Test
    void shouldMatchSubclassesOfExpectedTypes() {
        ExpectedExceptions expected = ExpectedExceptions.of(RuntimeException.class);

        assertThat(Outcome.classify(new UncheckedIOException(new IOException()), expected))
                .isEqualTo(Outcome.PASS);
        assertThat(Outcome.classify(new IOException(), expected)).isEqualTo(Outcome.ERROR);
    }

    @Test
    void shouldSeparateAssertionsFromErrors() {
        assertThat(Outcome.classify(new AssertionError(), ExpectedExceptions.none()))
                .isEqualTo(Outcome.FAIL);
        assertThat(
                        Outcome.classify(
                                new TestTimeoutError(Duration.ofMillis(5)),
                                ExpectedExceptions.none()))
                .isEqualTo(Outcome.FAIL);
        assertThat(Outcome.classify(new IllegalStateException(), ExpectedExceptions.none()))
                .isEqualTo(Outcome.ERROR);
    }

    @Test
    void shouldRequireAtLeastOneExpectedType() {
        assertThatThrownBy(() -> ExpectedExceptions.of()).isInstanceOf(IllegalArgumentException.class);
    }
}
