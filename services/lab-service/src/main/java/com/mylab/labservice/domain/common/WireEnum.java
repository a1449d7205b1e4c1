package com.mylab.labservice.domain.common;

/**
 * Enum with a stable lowercase wire value used in JSON and in the database.
 */
public interface WireEnum {

    String value();

    /**
     * Resolves {@code raw} against the constants of {@code type}.
     *
     * @throws InvalidDataException naming the field and the accepted values
     */
    static <E extends Enum<E> & WireEnum> E parse(Class<E> type, String raw, String field) {
        if (raw != null) {
            for (E constant : type.getEnumConstants()) {
                if (constant.value().equalsIgnoreCase(raw.strip())) {
                    return constant;
                }
            }
        }
        StringBuilder accepted = new StringBuilder();
        for (E constant : type.getEnumConstants()) {
            if (accepted.length() > 0) {
                accepted.append(", ");
            }
            accepted.append(constant.value());
        }
        throw new InvalidDataException("Invalid %s '%s'; expected one of: %s".formatted(field, raw, accepted));
    }
}
