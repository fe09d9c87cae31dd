package com.ivamare.connect.mapping;

import com.ivamare.connect.document.Document;

/**
 * A named pure function computing a raw field value from a document.
 */
@FunctionalInterface
public interface MappingMethod {

    Object apply(Document doc) throws Exception;
}
