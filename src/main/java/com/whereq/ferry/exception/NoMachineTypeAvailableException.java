package com.whereq.ferry.exception;

/**
 * No machine type in the catalog satisfies the requested cores and memory
 */
public class NoMachineTypeAvailableException extends ResourceSpecException {

    private final boolean prefixFiltered;

    private NoMachineTypeAvailableException(String message, boolean prefixFiltered) {
        super(message);
        this.prefixFiltered = prefixFiltered;
    }

    public static NoMachineTypeAvailableException prefixTooStrict(String prefix) {
        return new NoMachineTypeAvailableException(String.format(
            "Machine prefix %s is too strict, or the resources cannot be satisfied, "
                + "so there are no options available.", prefix), true);
    }

    public static NoMachineTypeAvailableException exceedsCatalog(long requestedMemoryMb, int requestedCores,
                                                                   long availableMemoryMb, int availableCores) {
        return new NoMachineTypeAvailableException(String.format(
            "You requested %d MB memory, %d cores. The maximum available are %d MB memory and %d cores. "
                + "These resources cannot be satisfied. Please consider reducing the resource "
                + "requirements of the corresponding rule.",
            requestedMemoryMb, requestedCores, availableMemoryMb, availableCores), false);
    }

    /**
     * True when the machine-type prefix override emptied the candidate set
     */
    public boolean isPrefixFiltered() {
        return prefixFiltered;
    }
}
