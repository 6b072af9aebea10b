package io.formflow.core.jobapp;

import java.nio.file.Path;
import java.util.List;

/// Queryable handle over indexed documents, produced by a {@link DocumentIndexService}.
///
/// Opaque to the workflow; only the service that created it knows how to query it.
public interface DocumentIndex {

    /// Returns the source documents this index was built from.
    ///
    /// @return document paths, never null
    List<Path> documents();
}
