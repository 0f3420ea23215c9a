package io.buildcv.backend.multitenancy;

public enum StoreMode {
  /** No signed-in user; data lives in the device-local store. */
  ANONYMOUS,
  /** Signed-in user; data lives in the user's tenant database. */
  AUTHENTICATED
}
