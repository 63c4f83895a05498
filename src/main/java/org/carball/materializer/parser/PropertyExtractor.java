package org.carball.materializer.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.*;
import org.carball.materializer.model.query.QueryRecord;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Finds JSON extraction calls against the raw properties column in logged SELECT queries.
 */
@Slf4j
public class PropertyExtractor {

    private static final Set<String> EXTRACTION_FUNCTIONS = Set.of(
            "jsonextractstring",
            "jsonextractraw",
            "jsonextractint",
            "jsonextractuint",
            "jsonextractfloat",
            "jsonextractbool",
            "jsonextract",
            "jsonhas"
    );

    // Cheap filter so queries without extraction calls are never parsed
    private static final Pattern EXTRACTION_HINT = Pattern.compile("JSON(?:Extract|Has)", Pattern.CASE_INSENSITIVE);

    private static final Pattern SETTINGS_CLAUSE = Pattern.compile("\\s+SETTINGS\\s+[^()]*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORMAT_CLAUSE = Pattern.compile("\\s+FORMAT\\s+[A-Za-z]+\\s*$", Pattern.CASE_INSENSITIVE);

    private final String rawColumn;

    public PropertyExtractor(String rawColumn) {
        this.rawColumn = rawColumn;
    }

    /**
     * Returns the distinct property references of one query, in order of first appearance.
     *
     * @throws QueryParseException if the query mentions an extraction call but cannot be parsed
     */
    public List<PropertyReference> extract(QueryRecord query) throws QueryParseException {
        String sql = query.queryText();
        if (sql == null || !EXTRACTION_HINT.matcher(sql).find()) {
            return List.of();
        }

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(preprocessSql(sql));
        } catch (JSQLParserException e) {
            throw new QueryParseException(query.queryId(),
                    "Unparseable query " + query.queryId() + ": " + firstLine(e.getMessage()), e);
        }

        if (!(statement instanceof Select select)) {
            log.trace("Skipping non-SELECT query {}", query.queryId());
            return List.of();
        }

        ReferenceCollector collector = new ReferenceCollector(query.tableName());
        collector.walk(select);
        return new ArrayList<>(collector.references);
    }

    static String preprocessSql(String sql) {
        String processed = sql.trim();
        if (processed.endsWith(";")) {
            processed = processed.substring(0, processed.length() - 1);
        }
        // ClickHouse trailers JSqlParser does not understand
        processed = FORMAT_CLAUSE.matcher(processed).replaceAll("");
        processed = SETTINGS_CLAUSE.matcher(processed).replaceAll("");
        processed = FORMAT_CLAUSE.matcher(processed).replaceAll("");
        return processed;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "no detail";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static String unquote(String identifier) {
        if (identifier == null || identifier.length() < 2) {
            return identifier;
        }
        char first = identifier.charAt(0);
        char last = identifier.charAt(identifier.length() - 1);
        if ((first == '`' && last == '`') || (first == '"' && last == '"')) {
            return identifier.substring(1, identifier.length() - 1);
        }
        return identifier;
    }

    /**
     * Walks one statement, tracking the tables in scope for each SELECT so that
     * a qualified {@code e.properties} resolves through its alias.
     */
    private class ReferenceCollector extends ExpressionVisitorAdapter {

        private final String fallbackTable;
        private final Set<PropertyReference> references = new LinkedHashSet<>();
        private final Deque<Scope> scopes = new ArrayDeque<>();

        ReferenceCollector(String fallbackTable) {
            this.fallbackTable = fallbackTable;
            setSelectVisitor(new SelectVisitorAdapter() {
                @Override
                public void visit(PlainSelect plainSelect) {
                    walkPlainSelect(plainSelect);
                }

                @Override
                public void visit(SetOperationList setOperationList) {
                    walk(setOperationList);
                }

                @Override
                public void visit(ParenthesedSelect parenthesedSelect) {
                    walk(parenthesedSelect);
                }
            });
        }

        void walk(Select select) {
            if (select.getWithItemsList() != null) {
                for (WithItem withItem : select.getWithItemsList()) {
                    if (withItem.getSelect() != null) {
                        walk(withItem.getSelect());
                    }
                }
            }

            if (select instanceof PlainSelect plainSelect) {
                walkPlainSelect(plainSelect);
            } else if (select instanceof SetOperationList setOperationList) {
                for (Select member : setOperationList.getSelects()) {
                    walk(member);
                }
            } else if (select instanceof ParenthesedSelect parenthesedSelect) {
                walk(parenthesedSelect.getSelect());
            }
        }

        private void walkPlainSelect(PlainSelect plainSelect) {
            Scope scope = new Scope();
            registerFromItem(plainSelect.getFromItem(), scope);
            if (plainSelect.getJoins() != null) {
                for (Join join : plainSelect.getJoins()) {
                    registerFromItem(join.getRightItem(), scope);
                }
            }

            scopes.push(scope);
            try {
                for (SelectItem<?> item : plainSelect.getSelectItems()) {
                    accept(item.getExpression());
                }
                if (plainSelect.getJoins() != null) {
                    for (Join join : plainSelect.getJoins()) {
                        if (join.getOnExpressions() != null) {
                            join.getOnExpressions().forEach(this::accept);
                        }
                    }
                }
                accept(plainSelect.getWhere());
                if (plainSelect.getGroupBy() != null && plainSelect.getGroupBy().getGroupByExpressionList() != null) {
                    acceptAll(plainSelect.getGroupBy().getGroupByExpressionList());
                }
                accept(plainSelect.getHaving());
                if (plainSelect.getOrderByElements() != null) {
                    for (OrderByElement orderBy : plainSelect.getOrderByElements()) {
                        accept(orderBy.getExpression());
                    }
                }
            } finally {
                scopes.pop();
            }
        }

        private void registerFromItem(FromItem fromItem, Scope scope) {
            if (fromItem instanceof Table table) {
                String name = unquote(table.getName());
                scope.tables.add(name);
                scope.aliases.put(name.toLowerCase(Locale.ROOT), name);
                if (table.getAlias() != null) {
                    scope.aliases.put(unquote(table.getAlias().getName()).toLowerCase(Locale.ROOT), name);
                }
            } else if (fromItem instanceof ParenthesedSelect subquery) {
                walk(subquery.getSelect());
            }
        }

        private void accept(Expression expression) {
            if (expression != null) {
                expression.accept(this);
            }
        }

        private void acceptAll(List<?> expressions) {
            for (Object expression : expressions) {
                if (expression instanceof Expression e) {
                    accept(e);
                }
            }
        }

        @Override
        public void visit(Function function) {
            String name = function.getName() == null ? "" : function.getName().toLowerCase(Locale.ROOT);
            ExpressionList<?> parameters = function.getParameters();
            if (EXTRACTION_FUNCTIONS.contains(name) && parameters != null && parameters.size() >= 2) {
                Expression source = parameters.get(0);
                Expression path = parameters.get(1);
                if (source instanceof Column column
                        && rawColumn.equalsIgnoreCase(unquote(column.getColumnName()))
                        && path instanceof StringValue literal) {
                    String table = resolveTable(column);
                    if (literal.getValue().isEmpty()) {
                        log.debug("Ignoring {} with an empty property path", function.getName());
                    } else if (table != null && !table.isBlank()) {
                        references.add(new PropertyReference(table, literal.getValue()));
                    } else {
                        log.debug("Could not attribute {}({}) to a table", function.getName(), literal.getValue());
                    }
                }
            }
            super.visit(function);
        }

        private String resolveTable(Column column) {
            Scope scope = scopes.peek();
            if (column.getTable() != null && column.getTable().getName() != null && scope != null) {
                String qualifier = unquote(column.getTable().getName()).toLowerCase(Locale.ROOT);
                String resolved = scope.aliases.get(qualifier);
                if (resolved != null) {
                    return resolved;
                }
            }
            if (scope != null && !scope.tables.isEmpty()) {
                return scope.tables.get(0);
            }
            return fallbackTable;
        }
    }

    private static class Scope {
        private final List<String> tables = new ArrayList<>();
        private final Map<String, String> aliases = new HashMap<>();
    }
}
