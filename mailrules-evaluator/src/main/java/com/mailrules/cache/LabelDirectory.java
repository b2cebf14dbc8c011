package com.mailrules.cache;

import com.mailrules.api.exceptions.LabelDirectoryException;

import java.util.Map;

/**
 * Remote listing of the mailbox's labels.
 *
 * <p>Implementations wrap the provider's label API; the engine never calls it directly.
 */
@FunctionalInterface
public interface LabelDirectory {

    /**
     * @return every label as display name → provider label identifier
     * @throws LabelDirectoryException if the listing call fails
     */
    Map<String, String> listLabels() throws LabelDirectoryException;
}
