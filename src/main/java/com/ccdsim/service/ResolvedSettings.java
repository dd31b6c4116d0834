package com.ccdsim.service;

import com.ccdsim.model.Flags;
import com.ccdsim.model.HeaderIssue;
import com.ccdsim.model.Parameters;

import java.util.Collections;
import java.util.List;

/**
 * Parameters and flags resolved for one frame, with the header findings met on the way.
 */
public class ResolvedSettings {

    private final Parameters parameters;
    private final Flags flags;
    private final List<HeaderIssue> issues;

    public ResolvedSettings(Parameters parameters, Flags flags, List<HeaderIssue> issues) {
        this.parameters = parameters;
        this.flags = flags;
        this.issues = Collections.unmodifiableList(issues);
    }

    public Parameters getParameters() {
        return parameters;
    }

    public Flags getFlags() {
        return flags;
    }

    public List<HeaderIssue> getIssues() {
        return issues;
    }
}
