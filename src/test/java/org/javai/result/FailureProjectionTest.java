package org.javai.result;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FailureProjectionTest {

    @Test
    void foreach_runsOnlyOnFailure() {
        List<String> seen = new ArrayList<>();

        Result.<Integer, String>failure("boom").projection().foreach(seen::add);
        Result.<Integer, String>success(1).projection().foreach(seen::add);

        assertThat(seen).containsExactly("boom");
    }

    @Test
    void getOrElse_returnsErrorOrDefault() {
        assertThat(Result.<Integer, String>failure("boom").projection().getOrElse(() -> "none")).isEqualTo("boom");
        assertThat(Result.<Integer, String>success(1).projection().getOrElse(() -> "none")).isEqualTo("none");
    }

    @Test
    void orElse_failure_returnsUnderlyingResult() {
        Result<Integer, String> failure = Result.failure("boom");

        assertThat(failure.projection().orElse(() -> Result.failure("other"))).isSameAs(failure);
    }

    @Test
    void orElse_success_returnsAlternative() {
        Result<Integer, String> success = Result.success(1);

        assertThat(success.projection().orElse(() -> Result.failure("other"))).isEqualTo(Result.failure("other"));
    }

    @Test
    void contains_forall_exists_evaluateErrorSide() {
        FailureProjection<Integer, String> failure = Result.<Integer, String>failure("boom").projection();
        FailureProjection<Integer, String> success = Result.<Integer, String>success(1).projection();

        assertThat(failure.contains("boom")).isTrue();
        assertThat(failure.contains("bang")).isFalse();
        assertThat(success.contains("boom")).isFalse();

        assertThat(failure.forall(e -> e.startsWith("b"))).isTrue();
        assertThat(failure.forall(e -> e.isEmpty())).isFalse();
        assertThat(success.forall(e -> false)).isTrue();

        assertThat(failure.exists(e -> e.length() == 4)).isTrue();
        assertThat(success.exists(e -> true)).isFalse();
    }

    @Test
    void flatMap_failure_feedsErrorToMapper() {
        Result<String, Integer> result = Result.<String, String>failure("boom").projection()
                .flatMap(e -> Result.failure(e.length()));

        assertThat(result).isEqualTo(Result.failure(4));
    }

    @Test
    void flatMap_canRecoverIntoSuccess() {
        Result<String, Integer> result = Result.<String, String>failure("boom").projection()
                .flatMap(e -> Result.success("recovered from " + e));

        assertThat(result).isEqualTo(Result.success("recovered from boom"));
    }

    @Test
    void flatMap_success_passesThroughRetyped() {
        Result<String, Integer> result = Result.<String, String>success("fine").projection()
                .flatMap(e -> Result.failure(e.length()));

        assertThat(result).isEqualTo(Result.success("fine"));
    }

    @Test
    void flatMap_convertsExceptionFailureIntoErrorDetail() {
        Result<String, ErrorDetail> result = Result.<String, Exception>failure(new IllegalStateException("BOO"))
                .projection()
                .flatMap(e -> StringResult.failure(e.getMessage()));

        assertThat(result).isEqualTo(StringResult.failure("BOO"));
    }

    @Test
    void map_transformsErrorOnly() {
        assertThat(Result.<Integer, String>failure("boom").projection().map(String::length)).isEqualTo(Result.failure(4));
        assertThat(Result.<Integer, String>success(7).projection().map(String::length)).isEqualTo(Result.success(7));
    }

    @Test
    void map_successLosesProducerTypedForOldFailure() {
        Result<Integer, Integer> mapped = Result.<Integer, String>success(7, e -> "caught").projection().map(String::length);

        assertThat(mapped.failureProducer()).isEmpty();
    }

    @Test
    void safeMap_throwingMapper_returnsProducedFailure() {
        Result<Integer, ErrorDetail> result = Result.<Integer, String>failure("boom").projection()
                .safeMap(e -> { throw new IllegalStateException("cannot describe " + e); }, StringResult.PRODUCER);

        assertThat(result).isEqualTo(StringResult.failure("cannot describe boom"));
    }

    @Test
    void safeFlatMap_throwingMapper_returnsProducedFailure() {
        Result<Integer, ErrorDetail> result = Result.<Integer, String>failure("boom").projection()
                .safeFlatMap(e -> { throw new IllegalStateException("nope"); }, StringResult.PRODUCER);

        assertThat(result).isEqualTo(StringResult.failure("nope"));
    }

    @Test
    void toOptional_holdsErrorOnFailure() {
        assertThat(Result.<Integer, String>failure("boom").projection().toOptional()).contains("boom");
        assertThat(Result.<Integer, String>success(1).projection().toOptional()).isEmpty();
    }

    @Test
    void toTry_success_becomesFailureWithValueAsMessage() {
        Try<String> converted = Result.<Integer, String>success(314).projection().toTry();

        assertThat(converted.isFailure()).isTrue();
        assertThat(((Try.Failure<String>) converted).error())
                .isInstanceOf(ResultFailedException.class)
                .hasMessage("314");
    }

    @Test
    void toTry_failure_holdsError() {
        assertThat(Result.<Integer, String>failure("boom").projection().toTry().get()).isEqualTo("boom");
    }

    @Test
    void equality_followsProjectedResult() {
        assertThat(Result.failure("boom").projection()).isEqualTo(Result.failure("boom").projection());
        assertThat(Result.failure("boom").projection()).isNotEqualTo(Result.success("boom").projection());
    }
}
