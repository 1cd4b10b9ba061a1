package com.livebundle.core.watch;

import com.livebundle.core.model.ChangeEvent;

/**
 * Receives file changes observed in a session workspace.
 */
@FunctionalInterface
public interface ChangeListener {
    void onChange(ChangeEvent event);
}
