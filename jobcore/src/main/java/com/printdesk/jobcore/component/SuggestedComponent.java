package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;

/**
 * A component proposed by {@link ComponentSuggestionEngine}. Callers may
 * edit the list before persisting it.
 */
public record SuggestedComponent(
        ComponentType  type,
        String         name,
        String         description,
        ComponentOwner owner,
        boolean        artworkRequired,
        boolean        dataRequired,
        int            sortOrder
) {}
