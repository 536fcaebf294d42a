package org.apache.calcite.adapter.scrollreader.source.exception;

/**
 * Every candidate node failed. Terminal: the dataset cannot be constructed.
 */
public class NoHealthyNodeException extends ScrollReaderException {

    NoHealthyNodeException(String message) {
        super(message);
    }

    public static NoHealthyNodeException buildNoHealthyNodeException(String message) {
        return new NoHealthyNodeException(message);
    }
}
