package com.qualsim.core.error;

/**
 * A level name that is not part of the referenced qualitative space.
 */
public class UnknownLevelException extends DomainException {

    private final String space;
    private final String level;

    public UnknownLevelException(String space, String level) {
        super("Level '" + level + "' is not defined in space '" + space + "'");
        this.space = space;
        this.level = level;
    }

    public String getSpace() {
        return space;
    }

    public String getLevel() {
        return level;
    }
}
