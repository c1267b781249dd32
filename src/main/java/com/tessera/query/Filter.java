package com.tessera.query;

import java.util.List;

/**
 * A query filter: either a single member condition or a logical group.
 */
public interface Filter {

    /**
     * Every member referenced by this filter, in order of appearance.
     */
    List<String> getMembers();
}
