package com.relationalizer.sql;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.relationalizer.model.SqlType;
import com.relationalizer.model.TypeProfile;
import com.relationalizer.model.TypeTag;
import com.relationalizer.normalize.IdentifierKeys;

/**
 * Chooses the SQL type of a column from the type tags observed at its source path.
 */
public class ColumnTypeResolver {

    private static final Set<TypeTag> NUMERIC = EnumSet.of(TypeTag.INTEGER, TypeTag.FLOAT);

    private final TypeInferencePolicy policy;

    public ColumnTypeResolver(TypeInferencePolicy policy) {
        this.policy = policy;
    }

    public SqlType resolve(List<String> sourcePath, TypeProfile observations, boolean reference) {
        if (reference) {
            return SqlType.TEXT;
        }
        String field = sourcePath.get(sourcePath.size() - 1);
        if (IdentifierKeys.isGeneratedId(field)) {
            return SqlType.INTEGER;
        }
        Set<TypeTag> tags = observations.scalarValueTags();
        if (tags.isEmpty() || observations.hasShapeConflict()) {
            return SqlType.TEXT;
        }
        return switch (policy) {
            case TEXT_DEFAULT -> IdentifierKeys.isIdentifierLike(field) && tags.equals(EnumSet.of(TypeTag.INTEGER))
                    ? SqlType.INTEGER
                    : SqlType.TEXT;
            case AUTOMATIC -> automatic(tags);
        };
    }

    private static SqlType automatic(Set<TypeTag> tags) {
        if (tags.equals(EnumSet.of(TypeTag.INTEGER)) || tags.equals(EnumSet.of(TypeTag.BOOLEAN))) {
            return SqlType.INTEGER;
        }
        if (NUMERIC.containsAll(tags)) {
            return SqlType.REAL;
        }
        return SqlType.TEXT;
    }
}
