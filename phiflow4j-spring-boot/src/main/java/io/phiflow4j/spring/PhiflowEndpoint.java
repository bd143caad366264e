/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.spring;

import io.phiflow4j.core.transform.SubjectContextStore;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "phiflow")
public class PhiflowEndpoint {

    private final MicrometerAuditReporter reporter;
    private final SubjectContextStore subjects;

    public PhiflowEndpoint(MicrometerAuditReporter reporter, SubjectContextStore subjects) {
        this.reporter = reporter;
        this.subjects = subjects;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new HashMap<>();
        m.put("status", "OK");
        m.put("subjects", subjects.size());
        m.put("recentAudit", reporter.recentAudit());
        return m;
    }
}
