package org.laminar.process.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An actor of the process. Each role becomes one swimlane in the rendered diagram.
 */
public record Role(
        String roleId,
        String roleTitle,
        List<String> roleNotes) {

    public Role {
        roleNotes = roleNotes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(roleNotes));
    }

    public Role(String roleId, String roleTitle) {
        this(roleId, roleTitle, List.of());
    }
}
