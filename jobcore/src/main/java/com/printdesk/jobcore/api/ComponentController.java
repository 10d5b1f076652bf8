package com.printdesk.jobcore.api;

import com.printdesk.jobcore.api.dto.ValidationResponse;
import com.printdesk.jobcore.component.ComponentLine;
import com.printdesk.jobcore.component.ComponentSuggestionEngine;
import com.printdesk.jobcore.component.ComponentValidator;
import com.printdesk.jobcore.component.JobClassification;
import com.printdesk.jobcore.component.SuggestedComponent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Stateless component helpers used by the job entry form.
 *
 * POST /components/suggestions  classification → suggested components
 * POST /components/validation   component list → issues (always 200)
 */
@RestController
@RequestMapping("/components")
public class ComponentController {

    private final ComponentSuggestionEngine suggestionEngine;
    private final ComponentValidator        validator;

    public ComponentController(ComponentSuggestionEngine suggestionEngine, ComponentValidator validator) {
        this.suggestionEngine = suggestionEngine;
        this.validator        = validator;
    }

    @PostMapping("/suggestions")
    public List<SuggestedComponent> suggest(@RequestBody(required = false) JobClassification classification) {
        return suggestionEngine.suggest(classification);
    }

    @PostMapping("/validation")
    public ValidationResponse validate(@RequestBody(required = false) List<ComponentLine> components) {
        return ValidationResponse.of(validator.validate(components));
    }
}
