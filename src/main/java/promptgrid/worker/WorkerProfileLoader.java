package promptgrid.worker;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Loads a {@link WorkerProfile} from an INI file.
 *
 * <pre>
 * [worker]
 * id = gpu-box-1
 * threads = 4
 *
 * [capabilities]
 * families = transformers, local-llm
 *
 * [predictor]
 * min_delay_ms = 10
 * max_delay_ms = 50
 * fail_rate = 0.0
 * </pre>
 *
 * Only [worker] id and [capabilities] families are required.
 */
public final class WorkerProfileLoader {

    private WorkerProfileLoader() {
    }

    /**
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a required key is missing or a value is malformed
     */
    public static WorkerProfile load(Path file) throws IOException {
        Ini ini = new Ini(file.toFile());

        Profile.Section worker = ini.get("worker");
        Profile.Section capabilities = ini.get("capabilities");
        Profile.Section predictor = ini.get("predictor"); // optional

        if (worker == null || capabilities == null) {
            throw new IllegalArgumentException(file + ": [worker] and [capabilities] sections are required");
        }

        String workerId = opt(worker, "id", null);
        if (workerId == null) {
            throw new IllegalArgumentException(file + ": [worker] id is required");
        }

        int threads = toInt(file, "threads", opt(worker, "threads", "1"));
        Set<String> families = parseFamilies(opt(capabilities, "families", ""));

        WorkerProfile.SimulationSettings simulated = WorkerProfile.SimulationSettings.DEFAULT;
        if (predictor != null) {
            simulated = new WorkerProfile.SimulationSettings(
                    toInt(file, "min_delay_ms",
                            opt(predictor, "min_delay_ms", String.valueOf(simulated.minDelayMs()))),
                    toInt(file, "max_delay_ms",
                            opt(predictor, "max_delay_ms", String.valueOf(simulated.maxDelayMs()))),
                    toDouble(file, "fail_rate",
                            opt(predictor, "fail_rate", String.valueOf(simulated.failRate()))));
        }

        return new WorkerProfile(workerId, threads, families, simulated);
    }

    static Set<String> parseFamilies(String value) {
        Set<String> families = new LinkedHashSet<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(families::add);
        return families;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int toInt(Path file, String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(file + ": " + key + " is not an integer: " + value, e);
        }
    }

    private static double toDouble(Path file, String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(file + ": " + key + " is not a number: " + value, e);
        }
    }
}
