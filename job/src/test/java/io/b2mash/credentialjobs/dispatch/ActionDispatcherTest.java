package io.b2mash.credentialjobs.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.credentialjobs.backend.Credential;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.backend.CredentialProvider;
import io.b2mash.credentialjobs.backend.CredentialProviderRegistry;
import io.b2mash.credentialjobs.backend.OutputParameter;
import io.b2mash.credentialjobs.config.JobProperties;
import io.b2mash.credentialjobs.exception.JobConfigurationException;
import io.b2mash.credentialjobs.orchestrator.OrchestratorClient;
import io.b2mash.credentialjobs.orchestrator.TaskAcknowledgement;
import io.b2mash.credentialjobs.retry.BackendRetryPolicy;
import io.b2mash.credentialjobs.saga.ProvisioningSaga;
import io.b2mash.credentialjobs.saga.SagaState;
import io.b2mash.credentialjobs.task.TaskContext;
import io.b2mash.credentialjobs.task.TaskErrorCode;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ActionDispatcherTest {

  private static final TaskAcknowledgement ACK =
      new TaskAcknowledgement("task-1", "done", "iam-ServiceId-123");

  private OrchestratorClient orchestrator;
  private CredentialProviderRegistry registry;
  private CredentialProvider provider;
  private CredentialBackend backend;
  private ActionDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    orchestrator = mock(OrchestratorClient.class);
    registry = mock(CredentialProviderRegistry.class);
    provider = mock(CredentialProvider.class);
    backend = mock(CredentialBackend.class);
    when(orchestrator.reportFailed(any(), any(), anyString())).thenReturn(ACK);
    when(orchestrator.reportCreated(any(), any(), any())).thenReturn(ACK);
    when(orchestrator.reportDeleted(any())).thenReturn(ACK);
    when(provider.providerId()).thenReturn("iam-apikey");
    when(provider.outputParameters()).thenReturn(List.of(OutputParameter.required("apikey")));
    when(provider.connect(any())).thenReturn(backend);

    var retry = new JobProperties.Retry(3, Duration.ofSeconds(5), Duration.ofSeconds(15));
    var saga = new ProvisioningSaga(orchestrator, new BackendRetryPolicy(retry, millis -> {}));
    dispatcher =
        new ActionDispatcher(registry, saga, new JobProperties("iam-apikey", retry, null));
  }

  private static TaskContext context(String action, String credentialsId) {
    return new TaskContext(
        "secret-1", "task-abcdef", "group-1", "my-secret", null, null, action, credentialsId);
  }

  @Test
  void dispatch_unknownActionIsReportedOnceWithoutTouchingProvider() {
    var context = context("rotate_credentials", null);

    var outcome = dispatcher.dispatch(context);

    verify(orchestrator, times(1))
        .reportFailed(
            context, TaskErrorCode.UNKNOWN_ACTION, "unknown action: 'rotate_credentials'");
    verifyNoInteractions(registry, backend);
    verify(orchestrator, never()).reportCreated(any(), any(), any());
    verify(orchestrator, never()).reportDeleted(any());
    assertThat(outcome.state()).isEqualTo(SagaState.REPORTED_ERROR);
    assertThat(outcome.exitCode()).isNotZero();
  }

  @Test
  void dispatch_missingActionIsUnknown() {
    var outcome = dispatcher.dispatch(context(null, null));

    verify(orchestrator).reportFailed(any(), eq(TaskErrorCode.UNKNOWN_ACTION), anyString());
    assertThat(outcome.errorCode()).isEqualTo(TaskErrorCode.UNKNOWN_ACTION);
  }

  @Test
  void dispatch_unknownProviderIsReportedAsInvalidConfiguration() {
    when(registry.resolve("iam-apikey"))
        .thenThrow(new JobConfigurationException("unknown credential provider 'iam-apikey'"));

    var outcome = dispatcher.dispatch(context("create_credentials", null));

    verify(orchestrator)
        .reportFailed(
            any(),
            eq(TaskErrorCode.CONFIGURATION_INVALID),
            eq("unknown credential provider 'iam-apikey'"));
    verifyNoInteractions(backend);
    assertThat(outcome.exitCode()).isEqualTo(1);
  }

  @Test
  void dispatch_createActionRunsCreatePath() {
    when(registry.resolve("iam-apikey")).thenReturn(provider);
    when(backend.create()).thenReturn(new Credential("key-1", Map.of("apikey", "value")));

    var outcome = dispatcher.dispatch(context("create_credentials", null));

    verify(backend).create();
    verify(backend, never()).revoke(anyString());
    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.credentialsId()).isEqualTo("key-1");
  }

  @Test
  void dispatch_deleteActionRunsDeletePath() {
    when(registry.resolve("iam-apikey")).thenReturn(provider);

    var outcome = dispatcher.dispatch(context("delete_credentials", "key-1"));

    verify(backend).revoke("key-1");
    verify(backend, never()).create();
    verify(orchestrator).reportDeleted(any());
    assertThat(outcome.exitCode()).isZero();
  }
}
