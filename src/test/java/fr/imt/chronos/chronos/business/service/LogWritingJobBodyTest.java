package fr.imt.chronos.chronos.business.service;

import fr.imt.chronos.chronos.business.model.JobInvocation;
import fr.imt.chronos.chronos.business.service.jobs.LogWritingJobBody;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class LogWritingJobBodyTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsOneLinePerRunAndReturnsTheGreeting() throws Exception {
        Path outputFile = tempDir.resolve("job-outputs.log");
        LogWritingJobBody body = new LogWritingJobBody(outputFile, ZoneOffset.UTC);
        Instant startedAt = Instant.parse("2024-03-05T14:30:00Z");

        String output = body.execute(new JobInvocation("job-1", "Report", null, startedAt));
        body.execute(new JobInvocation("job-1", "Report", null, startedAt.plusSeconds(3600)));

        assertThat(output).isEqualTo("Hello World from job job-1 (Report) at Mar 5, 2024, 02:30:00 PM");
        assertThat(Files.readAllLines(outputFile)).containsExactly(
                "[2024-03-05T14:30:00Z] Job job-1 (Report): Hello World",
                "[2024-03-05T15:30:00Z] Job job-1 (Report): Hello World");
    }
}
