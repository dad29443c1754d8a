package io.eventcore.jdbc;

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
 * Skips container-backed store tests on machines without a reachable Docker daemon.
 * The daemon is probed once per test JVM.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.Probe.class)
@interface DockerAvailable {

  final class Probe implements ExecutionCondition {
    private static final ExtensionContext.Namespace NAMESPACE =
        ExtensionContext.Namespace.create(DockerAvailable.class);

    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      boolean reachable = context.getRoot().getStore(NAMESPACE).getOrComputeIfAbsent(
          "docker", key -> DockerClientFactory.instance().isDockerAvailable(), Boolean.class);
      return reachable
          ? ConditionEvaluationResult.enabled("Docker daemon reachable")
          : ConditionEvaluationResult.disabled("No Docker daemon; skipping container tests");
    }
  }
}
