package fr.uga.amdn.extract;

/**
 * The three relations a proposition can have with an action.
 */
public enum Role {
    PRECONDITION("is a precondition of"),
    ADD("is added by"),
    DELETE("is deleted by");

    private final String phrase;

    Role(String phrase) {
        this.phrase = phrase;
    }

    public String getPhrase() {
        return this.phrase;
    }
}
