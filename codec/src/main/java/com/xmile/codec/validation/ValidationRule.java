package com.xmile.codec.validation;

import com.xmile.codec.schema.Model;
import java.util.List;

/**
 * A single cross-reference check over one model. Rules are deterministic and report problems in the
 * order they find them, so results can be compared directly in tests.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given model.
     *
     * @param model A decoded or programmatically built model.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<ValidationMessage> validate(Model model);
}
