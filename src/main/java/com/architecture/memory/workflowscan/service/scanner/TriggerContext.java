package com.architecture.memory.workflowscan.service.scanner;

import lombok.Value;

/**
 * File-level facts stamped on every trigger node a UI scanner emits.
 */
@Value
class TriggerContext {
    // prefix of the node name, e.g. "UI" gives "UI: Click"
    String label;
    String framework;
    String component;
    String url;
}
