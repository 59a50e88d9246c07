package com.linlay.carassist.plan;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanValidatorTest {

    private final PlanValidator validator = new PlanValidator();

    @Test
    void chatPlanWithStringAnswerShouldPass() {
        assertThat(validator.validate(Map.of("action", "chat", "answer", "Hello"))).isEmpty();
    }

    @Test
    void chatPlanWithoutStringAnswerShouldFail() {
        assertThat(validator.validate(Map.of("action", "chat"))).isPresent();
        assertThat(validator.validate(Map.of("action", "chat", "answer", 42))).isPresent();
    }

    @Test
    void nonMappingShouldFail() {
        assertThat(validator.validate(List.of("chat"))).contains("plan is not a JSON object");
        assertThat(validator.validate(null)).isPresent();
    }

    @Test
    void unknownActionShouldFail() {
        assertThat(validator.validate(Map.of("action", "respond", "answer", "x"))).isPresent();
        assertThat(validator.validate(Map.of("answer", "x"))).isPresent();
    }

    @Test
    void toolOutsideClosedSetShouldFail() {
        assertThat(validator.validate(Map.of("action", "tool", "name", "drop_tables", "args", Map.of())))
                .hasValueSatisfying(reason -> assertThat(reason).contains("drop_tables"));
    }

    @Test
    void toolArgsMustBeMapping() {
        assertThat(validator.validate(Map.of("action", "tool", "name", "get_all_cars", "args", "none"))).isPresent();
        assertThat(validator.validate(Map.of("action", "tool", "name", "get_all_cars"))).isPresent();
    }

    @Test
    void everySessionOwnedKeyShouldBeRejected() {
        for (String key : PlanValidator.SESSION_OWNED_KEYS) {
            Map<String, Object> plan = Map.of("action", "tool", "name", "car_add", "args", Map.of(key, "x"));
            assertThat(validator.validate(plan)).as(key).isPresent();
        }
    }

    @Test
    void restrictedFieldShouldBeRejected() {
        Map<String, Object> plan = Map.of("action", "tool", "name", "car_update",
                "args", Map.of("car_id", 1, "buyer_offer_cents", 500000));

        assertThat(validator.validate(plan)).hasValueSatisfying(reason -> assertThat(reason).contains("buyer_offer_cents"));
    }

    @Test
    void sellerAskShouldBeAllowed() {
        Map<String, Object> plan = Map.of("action", "tool", "name", "car_update",
                "args", Map.of("car_id", 1, "seller_ask_cents", 1_250_000));

        assertThat(validator.validate(plan)).isEmpty();
    }

    @Test
    void validationShouldBeIdempotentAndLeaveInputAlone() {
        Map<String, Object> args = new HashMap<>();
        args.put("vin", "X");
        args.put("lead_id", 3);
        Map<String, Object> plan = new HashMap<>();
        plan.put("action", "tool");
        plan.put("name", "car_update");
        plan.put("args", args);

        assertThat(validator.validate(plan)).isEqualTo(validator.validate(plan));
        assertThat(args).containsOnlyKeys("vin", "lead_id");
    }

    @Test
    void toPlanShouldBuildTypedPlans() {
        assertThat(validator.toPlan(Map.of("action", "chat", "answer", "Hi"))).isEqualTo(new Plan.Chat("Hi"));

        Plan plan = validator.toPlan(Map.of("action", "tool", "name", "get_all_cars", "args", Map.of()));
        assertThat(plan).isInstanceOf(Plan.Tool.class);
        assertThat(((Plan.Tool) plan).name()).isEqualTo("get_all_cars");
    }

    @Test
    void toPlanShouldRefuseInvalidPlans() {
        assertThatThrownBy(() -> validator.toPlan(Map.of("action", "tool", "name", "nope", "args", Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
