package com.challenges.stagedb.statement;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.Stage;
import com.challenges.stagedb.pipeline.StageContext;
import com.challenges.stagedb.pipeline.WorkUnit;
import com.challenges.stagedb.predicate.Predicate;
import com.challenges.stagedb.predicate.PredicateParser;
import com.challenges.stagedb.predicate.PredicateSyntaxException;

import java.util.regex.Pattern;

/**
 * Base for stages that turn raw statement text into a {@link StatementSpec}. Applies only
 * to {@link Payload.Statement} units whose text starts with the stage's keyword prefix,
 * so a parser never sees its own output. Syntax failures become error terminals.
 */
public abstract class StatementParseStage implements Stage {
    private final PredicateParser predicateParser = new PredicateParser();

    /**
     * Case-insensitive pattern anchored at the start of the statement.
     */
    protected abstract Pattern prefix();

    /**
     * @throws StatementSyntaxException   if the statement does not fit the grammar
     * @throws PredicateSyntaxException   if its WHERE clause does not parse
     */
    protected abstract StatementSpec parse(String sql);

    @Override
    public boolean appliesTo(WorkUnit unit) {
        return unit.payload() instanceof Payload.Statement statement
            && prefix().matcher(statement.text().stripLeading()).lookingAt();
    }

    @Override
    public void transform(WorkUnit unit, StageContext context) {
        String sql = normalize(unit.payloadAs(Payload.Statement.class).text());
        try {
            context.emit(parse(sql));
        } catch (PredicateSyntaxException e) {
            context.emit(Payload.Terminal.error("Invalid WHERE condition: " + e.fragment()));
        } catch (StatementSyntaxException e) {
            context.emit(Payload.Terminal.error(e.getMessage()));
        }
    }

    protected Predicate parseWhere(String clause) {
        return predicateParser.parse(clause);
    }

    /**
     * Trims the statement and drops one trailing semicolon.
     */
    static String normalize(String sql) {
        String trimmed = sql.trim();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    static Pattern keyword(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
