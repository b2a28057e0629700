package eu.fbk.rdfquads.rio;

/**
 * Kinds of tokens produced by {@link TurtleLexer}.
 */
public enum TokenType {

    IRIREF("IRI"),

    PNAME_NS("prefix declaration name"),

    PNAME_LN("prefixed name"),

    BLANK_NODE_LABEL("blank node label"),

    STRING_LITERAL("string"),

    LANGTAG("language tag"),

    INTEGER("integer"),

    DECIMAL("decimal"),

    DOUBLE("double"),

    BOOLEAN("boolean"),

    DOT("'.'"),

    COMMA("','"),

    SEMICOLON("';'"),

    LBRACKET("'['"),

    RBRACKET("']'"),

    LPAREN("'('"),

    RPAREN("')'"),

    LBRACE("'{'"),

    RBRACE("'}'"),

    DATATYPE("'^^'"),

    A("'a'"),

    PREFIX("prefix directive"),

    BASE("base directive"),

    GRAPH("'GRAPH'"),

    VARIABLE("variable"),

    EQUALS("'='"),

    IMPLIES("'=>'"),

    IMPLIED_BY("'<='"),

    PATH("path operator"),

    KEYWORD("keyword"),

    EOF("end of input");

    private final String description;

    private TokenType(final String description) {
        this.description = description;
    }

    /**
     * Returns a human readable description of the token kind, used in error messages.
     *
     * @return the description
     */
    public String getDescription() {
        return this.description;
    }

}
