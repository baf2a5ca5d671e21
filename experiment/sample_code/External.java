package experiment.sample_code;

/**
 * Sample class calling methods whose contracts come from contracts.json.
 */
public class External {

    @com.wp.verifier.annotations.Requires("n >= 0")
    @com.wp.verifier.annotations.Ensures("result >= 0")
    public int root(int n) {
        return isqrt(n);
    }

    // Fails the call precondition of isqrt
    @com.wp.verifier.annotations.Ensures("result >= 0")
    public int anyRoot(int n) {
        return isqrt(n);
    }
}
