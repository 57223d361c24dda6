package com.jsast.ast;

import java.util.Map;

/**
 * A value that exposes its content as an ordered mapping of field name to value.
 * The iteration order of the returned map is the declaration order of the fields.
 */
public interface FieldContainer {

    Map<String, Object> fields();
}
