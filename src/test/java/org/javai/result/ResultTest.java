package org.javai.result;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ResultTest {

    record Person(String name, int age) {}

    @Test
    void success_isSuccess() {
        Result<String, String> result = Result.success("test");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isFailure()).isFalse();
        assertThat(result).isInstanceOf(Result.Success.class);
    }

    @Test
    void failure_isFailure() {
        Result<String, String> result = Result.failure("test");

        assertThat(result.isFailure()).isTrue();
        assertThat(result.isSuccess()).isFalse();
        assertThat(((Result.Failure<String, String>) result).error()).isEqualTo("test");
    }

    @Test
    void failure_rejectsNullError() {
        assertThatThrownBy(() -> Result.failure(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("error must not be null");
    }

    @Test
    void success_equalityIgnoresProducer() {
        Result<Integer, String> plain = Result.success(314);
        Result<Integer, String> withProducer = Result.success(314, e -> "boom");

        assertThat(withProducer).isEqualTo(plain);
        assertThat(withProducer.hashCode()).isEqualTo(plain.hashCode());
        assertThat(withProducer).hasToString("Success[value=314]");
        assertThat(withProducer).isNotEqualTo(Result.failure(314));
    }

    @Test
    void fold_success_appliesSuccessFunction() {
        String folded = Result.<String, String>success("yay!").fold(String::toUpperCase, e -> "damn");

        assertThat(folded).isEqualTo("YAY!");
    }

    @Test
    void fold_failure_appliesFailureFunction() {
        String folded = StringResult.<String>failure("BOO")
                .fold(String::toUpperCase, detail -> detail.entries().get(0).message().toLowerCase());

        assertThat(folded).isEqualTo("boo");
    }

    @Test
    void fold_throwingFunction_propagates() {
        Result<String, String> result = Result.success("yay!");

        assertThatThrownBy(() -> result.fold(s -> { throw new IllegalStateException("oops"); }, e -> e))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("oops");
    }

    @Test
    void swap_exchangesSides() {
        assertThat(Result.<Integer, String>success(314).swap()).isEqualTo(Result.<String, Integer>failure(314));
        assertThat(Result.<String, Integer>failure(314).swap()).isEqualTo(Result.<Integer, String>success(314));
    }

    @Test
    void swap_dropsAttachedProducer() {
        Result<String, Integer> swapped = Result.<Integer, String>failure("boo").swap();

        assertThat(swapped.failureProducer()).isEmpty();
    }

    @Test
    void swap_withProducer_attachesProducerToNewSuccess() {
        FailureProducer<Integer> producer = e -> -1;

        Result<String, Integer> swapped = Result.<Integer, String>failure("boo").swap(producer);

        assertThat(swapped.failureProducer()).containsSame(producer);
        assertThat(swapped.safeMap(s -> { throw new IllegalStateException(); }))
                .isEqualTo(Result.failure(-1));
    }

    @Test
    void foreach_success_runsEffect() {
        Result<Integer, String> success = Result.success(314);
        int[] holder = {0};

        success.foreach(value -> holder[0] = value * 2);

        assertThat(holder[0]).isEqualTo(628);
        assertThat(success).isEqualTo(Result.success(314));
    }

    @Test
    void foreach_failure_skipsEffect() {
        List<Integer> seen = new ArrayList<>();

        Result.<Integer, String>failure("nope").foreach(seen::add);

        assertThat(seen).isEmpty();
    }

    @Test
    void foreach_throwingEffect_propagates() {
        assertThatThrownBy(() -> Result.success(314).foreach(v -> { throw new IllegalArgumentException("ouch!"); }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("ouch!");
    }

    @Test
    void getOrElse_returnsValueOrDefault() {
        assertThat(Result.<String, String>success("yay!").getOrElse(() -> "boo")).isEqualTo("yay!");
        assertThat(Result.<String, String>failure("yay!").getOrElse(() -> "boo")).isEqualTo("boo");
    }

    @Test
    void orElse_success_returnsSameInstance() {
        Result<String, Integer> success = Result.success("yay!");

        assertThat(success.orElse(() -> Result.success("boo"))).isSameAs(success);
    }

    @Test
    void orElse_failure_returnsAlternative() {
        Result<String, Integer> failure = Result.failure(314);

        assertThat(failure.orElse(() -> Result.success("boo"))).isEqualTo(Result.success("boo"));
    }

    @Test
    void contains_matchesOnlySuccessValue() {
        assertThat(Result.<Person, String>success(new Person("henry", 40)).contains(new Person("henry", 40))).isTrue();
        assertThat(Result.<Person, String>success(new Person("henry", 40)).contains(new Person("jane", 40))).isFalse();
        assertThat(Result.<Person, String>failure("nobody").contains(new Person("henry", 40))).isFalse();
    }

    @Test
    void forall_failure_isVacuouslyTrue() {
        assertThat(Result.<Integer, String>failure("nope").forall(v -> v % 2 == 0)).isTrue();
        assertThat(Result.<Integer, String>success(3).forall(v -> v % 2 == 0)).isFalse();
    }

    @Test
    void exists_failure_isFalse() {
        assertThat(Result.<Integer, String>failure("nope").exists(v -> true)).isFalse();
        assertThat(Result.<Integer, String>success(4).exists(v -> v % 2 == 0)).isTrue();
    }

    @Test
    void flatMap_success_returnsMapperResultUnchanged() {
        Result<Person, String> result = Result.<Person, String>success(new Person("baby", 2))
                .flatMap(p -> p.age() < 3 ? Result.success(new Person("real baby", 2)) : Result.failure("not a real baby"));

        assertThat(result).isEqualTo(Result.success(new Person("real baby", 2)));
    }

    @Test
    void flatMap_failure_shortCircuits() {
        List<Person> seen = new ArrayList<>();

        Result<Person, String> result = Result.<Person, String>failure("not a baby")
                .flatMap(p -> {
                    seen.add(p);
                    return Result.success(p);
                });

        assertThat(result).isEqualTo(Result.failure("not a baby"));
        assertThat(seen).isEmpty();
    }

    @Test
    void map_success_transformsValue() {
        assertThat(Result.<Integer, String>success(314).map(v -> v * 100).getOrElse(() -> 0)).isEqualTo(31400);
    }

    @Test
    void map_failure_passesThrough() {
        Result<Double, String> failure = Result.failure("oops!");

        Result<Double, String> mapped = failure.map(v -> v * 10);

        assertThat(mapped).isEqualTo(failure);
        assertThat(mapped.getOrElse(() -> -1.0)).isEqualTo(-1.0);
    }

    @Test
    void map_throwingFunction_propagates() {
        assertThatThrownBy(() -> StringResult.success("yay!").map(s -> { throw new IllegalStateException("boo"); }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void map_keepsAttachedProducer() {
        FailureProducer<String> producer = e -> "caught";

        Result<Integer, String> mapped = Result.<String, String>success("abc", producer).map(String::length);

        assertThat(mapped.failureProducer()).containsSame(producer);
    }

    @Test
    void map_thenGetOrElse_example() {
        assertThat(StringResult.success("yay!").map(String::toUpperCase).getOrElse(() -> "boo")).isEqualTo("YAY!");
    }

    @Test
    void flatten_nestedSuccess_returnsInner() {
        Result<Result<Integer, String>, String> nested = Result.success(Result.success(314));

        assertThat(Result.flatten(nested)).isEqualTo(Result.success(314));
    }

    @Test
    void flatten_successHoldingFailure_returnsInnerFailure() {
        Result<Result<Integer, String>, String> nested = Result.success(Result.failure("inner"));

        assertThat(Result.flatten(nested)).isEqualTo(Result.failure("inner"));
    }

    @Test
    void flatten_failure_isNotUnwrapped() {
        Result<Result<Integer, String>, String> failure = Result.failure("boo");

        assertThat(Result.flatten(failure)).isEqualTo(Result.failure("boo"));
    }

    @Test
    void toOptional_nullSuccessValue_isEmpty() {
        assertThat(Result.success("x").toOptional()).contains("x");
        assertThat(Result.success(null).toOptional()).isEmpty();
        assertThat(Result.failure("x").toOptional()).isEqualTo(Optional.empty());
    }

    @Test
    void toTry_failure_carriesStringFormOfError() {
        Try<String> converted = StringResult.<String>failure("boom").toTry();

        assertThat(converted.isFailure()).isTrue();
        Throwable error = ((Try.Failure<String>) converted).error();
        assertThat(error)
                .isInstanceOf(ResultFailedException.class)
                .hasMessage("[(error, boom)]");
        assertThat(((ResultFailedException) error).error()).isEqualTo(ErrorDetail.of("boom"));
    }

    @Test
    void toTry_success_holdsValue() {
        Try<String> converted = Result.success("yay").toTry();

        assertThat(converted.isSuccess()).isTrue();
        assertThat(converted.get()).isEqualTo("yay");
    }

    @Test
    void getOrThrow_failure_throwsResultFailedException() {
        Result<String, String> failure = Result.failure("boom");

        assertThatThrownBy(failure::getOrThrow)
                .isInstanceOf(ResultFailedException.class)
                .hasMessage("boom");
    }

    @Test
    void projection_wrapsResult() {
        Result<String, String> result = Result.failure("boom");

        assertThat(result.projection().result()).isSameAs(result);
    }

    @Test
    void failure_rejectsNullFunctionsLikeSuccess() {
        Result<Integer, String> failure = Result.failure("nope");

        assertThatThrownBy(() -> failure.foreach(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> failure.forall(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> failure.exists(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> failure.map(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> failure.flatMap(null)).isInstanceOf(NullPointerException.class);
    }
}
