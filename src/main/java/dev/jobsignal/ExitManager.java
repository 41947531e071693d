package dev.jobsignal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ends the process with a command's exit code.
 * Under a test runner the JVM is left alone.
 */
@Slf4j
@Component
public class ExitManager {
  public void exit(int status) {
    if (isTestRuntime()) {
      log.debug("Exit {} suppressed under test runner", status);
      return;
    }
    System.exit(status);
  }

  protected boolean isTestRuntime() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
