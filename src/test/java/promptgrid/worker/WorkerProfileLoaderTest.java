package promptgrid.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkerProfileLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsFullProfile() throws Exception {
        Path file = Paths.get(getClass().getResource("/worker.ini").toURI());

        WorkerProfile profile = WorkerProfileLoader.load(file);

        assertEquals("gpu-box-1", profile.workerId());
        assertEquals(4, profile.threads());
        assertEquals(Set.of("transformers", "local-llm"), profile.families());
        assertEquals(5, profile.simulated().minDelayMs());
        assertEquals(20, profile.simulated().maxDelayMs());
        assertEquals(0.1, profile.simulated().failRate(), 1e-9);
    }

    @Test
    void optionalKeysHaveDefaults() throws Exception {
        Path file = write("""
                [worker]
                id = cpu-1

                [capabilities]
                families = transformers
                """);

        WorkerProfile profile = WorkerProfileLoader.load(file);

        assertEquals(1, profile.threads());
        assertEquals(WorkerProfile.SimulationSettings.DEFAULT, profile.simulated());
    }

    @Test
    void missingSectionsOrKeysAreRejected() throws Exception {
        Path noCapabilities = write("""
                [worker]
                id = cpu-1
                """);
        Path noId = write("""
                [worker]
                threads = 2

                [capabilities]
                families = transformers
                """);
        Path noFamilies = write("""
                [worker]
                id = cpu-1

                [capabilities]
                families = ,
                """);

        assertThrows(IllegalArgumentException.class, () -> WorkerProfileLoader.load(noCapabilities));
        assertThrows(IllegalArgumentException.class, () -> WorkerProfileLoader.load(noId));
        assertThrows(IllegalArgumentException.class, () -> WorkerProfileLoader.load(noFamilies));
    }

    @Test
    void malformedNumbersAreRejected() throws Exception {
        Path badThreads = write("""
                [worker]
                id = cpu-1
                threads = many

                [capabilities]
                families = transformers
                """);
        Path badRate = write("""
                [worker]
                id = cpu-1

                [capabilities]
                families = transformers

                [predictor]
                fail_rate = 1.5
                """);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> WorkerProfileLoader.load(badThreads));
        assertTrue(e.getMessage().contains("threads"));
        assertThrows(IllegalArgumentException.class, () -> WorkerProfileLoader.load(badRate));
    }

    @Test
    void parseFamiliesTrimsAndDropsEmptyEntries() {
        assertEquals(Set.of("a", "b"), WorkerProfileLoader.parseFamilies(" a, ,b,a "));
        assertTrue(WorkerProfileLoader.parseFamilies("").isEmpty());
    }

    private Path write(String content) throws Exception {
        Path file = Files.createTempFile(dir, "worker", ".ini");
        Files.writeString(file, content);
        return file;
    }
}
