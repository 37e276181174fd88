package com.claudeye.core.transcript;

import java.util.List;

/**
 * Discovers the sessions the background scanner should visit.
 */
public interface SessionCatalog {

    /** Every known session across all projects, newest first. */
    List<SessionRef> listSessions();
}
