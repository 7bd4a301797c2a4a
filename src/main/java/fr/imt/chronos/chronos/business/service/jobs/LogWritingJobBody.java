package fr.imt.chronos.chronos.business.service.jobs;

import fr.imt.chronos.chronos.business.model.JobInvocation;
import fr.imt.chronos.chronos.business.service.JobBody;
import fr.imt.chronos.chronos.configuration.SchedulerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Default job body: says hello on the application log and appends a line to the job output file.
 */
@Component
@Slf4j
public class LogWritingJobBody implements JobBody {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("MMM d, yyyy, hh:mm:ss a", Locale.US);

    private final Path outputFile;
    private final ZoneId zone;

    @Autowired
    public LogWritingJobBody(@Value("${chronos.job-output.path:job-outputs.log}") String outputPath,
                             SchedulerProperties properties) {
        this(Path.of(outputPath), properties.getZone());
    }

    public LogWritingJobBody(Path outputFile, ZoneId zone) {
        this.outputFile = outputFile;
        this.zone = zone;
    }

    @Override
    public String execute(JobInvocation invocation) throws IOException {
        String output = String.format("Hello World from job %s (%s) at %s",
                invocation.jobId(),
                invocation.jobName(),
                DISPLAY_FORMAT.format(invocation.startedAt().atZone(zone)));
        log.info(output);

        String line = String.format("[%s] Job %s (%s): Hello World%n",
                invocation.startedAt(), invocation.jobId(), invocation.jobName());
        append(line);
        return output;
    }

    private synchronized void append(String line) throws IOException {
        Files.writeString(outputFile, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public Path getOutputFile() {
        return outputFile;
    }
}
