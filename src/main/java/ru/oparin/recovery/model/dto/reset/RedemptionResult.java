package ru.oparin.recovery.model.dto.reset;

import lombok.Value;
import ru.oparin.recovery.model.enums.RedemptionOutcome;

/**
 * Результат погашения токена. accountRef заполнен только при OK.
 */
@Value
public class RedemptionResult {

    RedemptionOutcome outcome;
    String accountRef;

    public static RedemptionResult ok(String accountRef) {
        return new RedemptionResult(RedemptionOutcome.OK, accountRef);
    }

    public static RedemptionResult rejected(RedemptionOutcome outcome) {
        return new RedemptionResult(outcome, null);
    }

    public boolean isOk() {
        return outcome == RedemptionOutcome.OK;
    }
}
