package com.whereq.ferry.exception;

/**
 * No accelerator in the selected zone can provide the requested number of cards
 */
public class NoAcceleratorAvailableException extends ResourceSpecException {
    public NoAcceleratorAvailableException(String zone, String model) {
        super(model != null
            ? String.format("An accelerator in zone %s with model %s cannot be satisfied, "
                + "so there are no options available.", zone, model)
            : String.format("An accelerator in zone %s cannot be satisfied, "
                + "so there are no options available.", zone));
    }
}
