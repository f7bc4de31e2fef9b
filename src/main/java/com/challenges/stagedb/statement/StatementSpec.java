package com.challenges.stagedb.statement;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.predicate.Predicate;
import com.challenges.stagedb.storage.TableSchema;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Objects;

/**
 * Typed form of a parsed statement, one variant per statement kind. Nullable components
 * mean the clause was absent.
 */
public sealed interface StatementSpec extends Payload {

    record CreateTable(TableSchema schema, boolean ifNotExists) implements StatementSpec {
        @Override
        public String describe() {
            return "create table " + schema;
        }
    }

    record DropTable(String table, boolean ifExists) implements StatementSpec {
        @Override
        public String describe() {
            return "drop table " + table;
        }
    }

    /**
     * @param columns explicit column list, empty when values are positional
     * @param rows    one value tuple per row to insert
     */
    record Insert(String table, ImmutableList<String> columns, ImmutableList<ImmutableList<Object>> rows)
        implements StatementSpec {

        public boolean hasColumnList() {
            return columns.notEmpty();
        }

        @Override
        public String describe() {
            return "insert " + rows.size() + " row(s) into " + table;
        }
    }

    /**
     * @param columns  requested columns, empty for {@code *}
     * @param where    filter, or null
     * @param orderBy  sort key, or null
     * @param limit    maximum rows, or null
     * @param offset   rows to skip, or null
     */
    record Select(String table,
                  ImmutableList<String> columns,
                  Predicate where,
                  OrderBy orderBy,
                  Integer limit,
                  Integer offset,
                  boolean distinct) implements StatementSpec {

        public Select {
            Objects.requireNonNull(table, "table");
            Objects.requireNonNull(columns, "columns");
        }

        public boolean selectAll() {
            return columns.isEmpty();
        }

        public boolean hasLimitOrOffset() {
            return limit != null || offset != null;
        }

        @Override
        public String describe() {
            StringBuilder sb = new StringBuilder("select ");
            if (distinct) {
                sb.append("distinct ");
            }
            sb.append(selectAll() ? "*" : columns.makeString(", ")).append(" from ").append(table);
            if (where != null) {
                sb.append(" where ").append(where);
            }
            if (orderBy != null) {
                sb.append(" order by ").append(orderBy.column()).append(' ').append(orderBy.direction());
            }
            if (limit != null) {
                sb.append(" limit ").append(limit);
            }
            if (offset != null) {
                sb.append(" offset ").append(offset);
            }
            return sb.toString();
        }
    }

    record OrderBy(String column, Direction direction) {
    }

    enum Direction {
        ASC,
        DESC
    }

    record Assignment(String column, Object value) {
    }

    record Update(String table, ImmutableList<Assignment> assignments, Predicate where) implements StatementSpec {

        /**
         * Assignments as a column to value map in statement order; values may be null.
         */
        public MutableMap<String, Object> changes() {
            MutableMap<String, Object> changes = Maps.mutable.empty();
            assignments.forEach(assignment -> changes.put(assignment.column(), assignment.value()));
            return changes;
        }

        @Override
        public String describe() {
            return "update " + table + (where != null ? " where " + where : "");
        }
    }

    record Delete(String table, Predicate where) implements StatementSpec {
        @Override
        public String describe() {
            return "delete from " + table + (where != null ? " where " + where : "");
        }
    }

    record SaveDatabase(String path) implements StatementSpec {
        @Override
        public String describe() {
            return "save database " + path;
        }
    }

    record LoadDatabase(String path) implements StatementSpec {
        @Override
        public String describe() {
            return "load database " + path;
        }
    }
}
