package mailqueue.jdbc;

import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Skips container-backed database tests on machines without Docker. The Docker probe runs
 * once per test JVM.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.DockerAvailableCondition.class)
public @interface DockerAvailable {

  class DockerAvailableCondition implements ExecutionCondition {
    private static volatile ConditionEvaluationResult probed;

    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      ConditionEvaluationResult result = probed;
      if (result == null) {
        result = probe();
        probed = result;
      }
      return result;
    }

    private static ConditionEvaluationResult probe() {
      try {
        DockerClientFactory.instance().client();
        return ConditionEvaluationResult.enabled("Docker found; running database container tests");
      } catch (Throwable t) {
        return ConditionEvaluationResult.disabled("No Docker, skipping database container tests: " + t.getMessage());
      }
    }
  }
}
