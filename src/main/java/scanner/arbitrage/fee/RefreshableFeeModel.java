package scanner.arbitrage.fee;

import scanner.arbitrage.model.FeeSchedule;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Fee model whose table can be replaced between scans. Readers always see one complete table.
 */
public class RefreshableFeeModel implements FeeModel {

    private final AtomicReference<StaticFeeModel> current;

    public RefreshableFeeModel(StaticFeeModel initial) {
        this.current = new AtomicReference<>(initial);
    }

    @Override
    public FeeSchedule resolve(String venueId) {
        return current.get().resolve(venueId);
    }

    @Override
    public FeeModel snapshot() {
        return current.get();
    }

    public void update(UnaryOperator<StaticFeeModel> change) {
        current.updateAndGet(change);
    }
}
