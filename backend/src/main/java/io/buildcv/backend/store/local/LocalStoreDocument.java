package io.buildcv.backend.store.local;

import io.buildcv.backend.store.Highlight;
import io.buildcv.backend.store.Job;
import io.buildcv.backend.store.Profile;
import java.util.List;

/** On-disk layout of a device's store. */
record LocalStoreDocument(int format, List<Job> jobs, List<Highlight> highlights, Profile profile) {

  static final int CURRENT_FORMAT = 1;

  LocalStoreDocument {
    jobs = jobs == null ? List.of() : jobs;
    highlights = highlights == null ? List.of() : highlights;
  }
}
