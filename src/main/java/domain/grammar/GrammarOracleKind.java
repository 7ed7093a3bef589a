package domain.grammar;

/** Grammar oracle selected on the command line. */
public enum GrammarOracleKind {

    /** JSqlParser grammar. */
    JSQLPARSER,

    /** No grammar: classifier kinds only, no internal nodes. */
    NONE
}
