package dev.jobsignal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobSignalApplication implements CommandLineRunner {

  private final CommandRunner commandRunner;
  private final ExitManager exitManager;

  public static void main(String[] args) {
    SpringApplication.run(JobSignalApplication.class, args);
  }

  @Override
  public void run(String... args) {
    try {
      int code = commandRunner.execute(args);
      exitManager.exit(code);
    } catch (Exception e) {
      log.error("Job Signal failed: {}", e.getMessage(), e);
      exitManager.exit(1);
    }
  }
}
