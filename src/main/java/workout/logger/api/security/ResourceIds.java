package workout.logger.api.security;

import workout.logger.api.exception.InvalidArgumentException;

/**
 * Parsing of the string identifiers that arrive over the API.
 */
public final class ResourceIds {

    private ResourceIds() {
    }

    /**
     * Parses a positive decimal identifier.
     *
     * @param resourceName used in the error message only
     * @param rawId the identifier as received
     * @throws InvalidArgumentException if the value is blank, not a number, or not positive
     */
    public static long parse(String resourceName, String rawId) {
        if (rawId == null || rawId.isBlank()) {
            throw new InvalidArgumentException("Missing " + resourceName + " ID");
        }
        long id;
        try {
            id = Long.parseLong(rawId.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid " + resourceName + " ID", e);
        }
        if (id <= 0) {
            throw new InvalidArgumentException("Invalid " + resourceName + " ID");
        }
        return id;
    }

    public static long parse(OwnershipChain chain, String rawId) {
        return parse(chain.getResourceName(), rawId);
    }

    public static String format(Long id) {
        return id == null ? null : Long.toString(id);
    }
}
