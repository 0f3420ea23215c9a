package io.buildcv.backend.provisioning;

/** Named steps of the tenant database provisioning saga, in execution order. */
public enum ProvisioningStep {
  CHECK_REGISTRY,
  RESTART_STALE,
  RECORD_CREATING,
  CREATE_DATABASE,
  ISSUE_CREDENTIALS,
  RECORD_LOCATION,
  APPLY_SCHEMA,
  ACTIVATE
}
