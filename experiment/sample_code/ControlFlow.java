package experiment.sample_code;

/**
 * Sample class demonstrating branches, early returns and panics.
 */
public class ControlFlow {

    // Simple conditional
    @com.wp.verifier.annotations.Ensures("result >= a && result >= b")
    @com.wp.verifier.annotations.Ensures("result == a || result == b")
    public int max(int a, int b) {
        if (a > b) {
            return a;
        } else {
            return b;
        }
    }

    // Early return
    @com.wp.verifier.annotations.Ensures("result >= 0")
    public int abs(int x) {
        if (x < 0) {
            return -x;
        }
        return x;
    }

    // Guarded panic, unreachable under the precondition
    @com.wp.verifier.annotations.Requires("b != 0")
    @com.wp.verifier.annotations.Ensures("result == a / b")
    public int divide(int a, int b) {
        if (b == 0) {
            throw new ArithmeticException("division by zero");
        }
        return a / b;
    }

    // Fails: the postcondition does not hold for x == 0
    @com.wp.verifier.annotations.Ensures("result > x")
    public int square(int x) {
        return x * x;
    }

    // Modular call: verified against the contract of abs
    @com.wp.verifier.annotations.Ensures("result >= 1")
    public int absPlusOne(int x) {
        int y = abs(x);
        return y + 1;
    }
}
