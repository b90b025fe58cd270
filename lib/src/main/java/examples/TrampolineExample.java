package examples;

import com.typelift.basis.config.TrampolineConfig;
import com.typelift.basis.functional.Trampoline;
import com.typelift.basis.functional.Trampolines;
import com.typelift.basis.version.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.typelift.basis.functional.Trampoline.later;
import static com.typelift.basis.functional.Trampoline.now;

/**
 * Example showing recursion that would overflow the stack if written directly.
 * <p>
 * Three shapes of deep recursion are run:
 * - Mutual recursion (isEven / isOdd) a million calls deep
 * - A left-nested bind chain a million binds long
 * - A mapM over a list of versions
 */
public class TrampolineExample {

    private static final Logger logger = LoggerFactory.getLogger(TrampolineExample.class);
    private static final int DEPTH = 1_000_000;

    public static void main(String[] args) {
        TrampolineConfig config = new TrampolineConfig()
                .setName("example")
                .setProgressLogInterval(250_000);

        logger.info("isEven({}) = {}", DEPTH, isEven(DEPTH).run(config));
        logger.info("isOdd({}) = {}", DEPTH + 1, isOdd(DEPTH + 1).run(config));
        logger.info("countUp({}) = {}", DEPTH, countUp(DEPTH).run(config));

        List<Version> versions = List.of(Version.parse("1.0"), Version.parse("1.1-beta"), Version.parse("2.0.1"));
        logger.info("bumped = {}", bumpAll(versions).run(config));
    }

    /**
     * Mutually recursive with {@link #isOdd(int)}; each call is suspended rather than made directly.
     */
    public static Trampoline<Boolean> isEven(int n) {
        if (n == 0) {
            return now(true);
        }
        return later(() -> isOdd(n - 1));
    }

    public static Trampoline<Boolean> isOdd(int n) {
        if (n == 0) {
            return now(false);
        }
        return later(() -> isEven(n - 1));
    }

    /**
     * Builds a left-nested chain of {@code n} increments starting from zero.
     */
    public static Trampoline<Integer> countUp(int n) {
        Trampoline<Integer> t = now(0);
        for (int i = 0; i < n; i++) {
            t = t.bind(x -> now(x + 1));
        }
        return t;
    }

    /**
     * Increments the last component of each version, dropping tags.
     */
    public static Trampoline<List<Version>> bumpAll(List<Version> versions) {
        return Trampolines.mapM(v -> now(bump(v)), versions);
    }

    private static Version bump(Version version) {
        int[] components = version.branch().stream().mapToInt(Integer::intValue).toArray();
        if (components.length > 0) {
            components[components.length - 1]++;
        }
        return Version.of(components);
    }
}
