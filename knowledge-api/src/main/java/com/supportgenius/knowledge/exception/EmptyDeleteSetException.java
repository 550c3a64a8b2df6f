package com.supportgenius.knowledge.exception;

/** A delete was requested without any ids. Callers treat this as "nothing left to delete". */
public class EmptyDeleteSetException extends KnowledgeException {

    public EmptyDeleteSetException(String namespace) {
        super(KnowledgeErrorCode.EMPTY_DELETE_SET, "No ids provided for delete request in namespace " + namespace);
    }
}
