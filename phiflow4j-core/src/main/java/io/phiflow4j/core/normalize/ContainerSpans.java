/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.normalize;

import io.phiflow4j.core.api.model.Span;
import java.util.List;

/** Compound tokens found in canonical text (informational, nothing enforces them). */
public record ContainerSpans(List<Span> urls, List<Span> filenames) {
    public ContainerSpans {
        urls = List.copyOf(urls);
        filenames = List.copyOf(filenames);
    }
}
