package gateway;

import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public class TestUtil {

    public static void eventually(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) return;
            Thread.sleep(10);
        }
        fail("Timed out waiting for: " + what);
    }
}
