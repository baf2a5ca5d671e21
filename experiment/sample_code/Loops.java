package experiment.sample_code;

/**
 * Sample class demonstrating loops with and without invariants.
 */
public class Loops {

    public int triangle(int n) {
        pre(n >= 1);
        post("2 * result == n * (n - 1)");
        int sum = 0;
        int i = 1;
        invariant("2 * sum == i * (i - 1)");
        invariant(i <= n);
        while (i < n) {
            sum += i;
            i++;
        }
        return sum;
    }

    @com.wp.verifier.annotations.Requires("n >= 0")
    @com.wp.verifier.annotations.Ensures("result == 2 * n")
    public int doubleByCounting(int n) {
        int total = 0;
        invariant(total == 2 * i && i <= n);
        for (int i : range(0, n)) {
            total = total + 2;
        }
        return total;
    }

    // Inconclusive: the loop has no invariant
    @com.wp.verifier.annotations.Requires("n >= 0")
    @com.wp.verifier.annotations.Ensures("result == n")
    public int count(int n) {
        int i = 0;
        while (i < n) {
            i = i + 1;
        }
        return i;
    }

    @com.wp.verifier.annotations.SkipVerification(reason = "uses arrays")
    public int sumArray(int[] values) {
        int sum = 0;
        for (int value : values) {
            sum += value;
        }
        return sum;
    }
}
