package org.loreweave.runtime.templates;

/**
 * Thrown when a template needs a capability the domain configuration does not supply.
 * This is an operator error and terminates the run.
 */
public class MissingCapabilityException extends IllegalStateException {

    private final String templateId;
    private final String capability;

    public MissingCapabilityException(String templateId, String capability) {
        super(templateId + " requires the '" + capability + "' capability, but the domain does not configure it");
        this.templateId = templateId;
        this.capability = capability;
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getCapability() {
        return capability;
    }
}
