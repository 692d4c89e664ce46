package com.vidnyan.vbuilder.domain.error;

import java.util.List;

/**
 * A module cannot be removed while instances still reference it.
 */
public class InUseException extends DesignException {

    private final List<String> instanceNames;

    public InUseException(String moduleName, List<String> instanceNames) {
        super(ErrorKind.IN_USE, String.format(
                "Cannot delete module '%s': it has %d instance(s) %s",
                moduleName, instanceNames.size(), instanceNames));
        this.instanceNames = List.copyOf(instanceNames);
    }

    public List<String> instanceNames() {
        return instanceNames;
    }
}
