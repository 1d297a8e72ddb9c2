package com.vtb.httptest.validation;

import com.vtb.httptest.exceptions.SchemaValidationException;
import com.vtb.httptest.models.HttpResponse;
import com.vtb.httptest.models.OperationDescriptor;
import com.vtb.httptest.models.SchemaValidationResult;
import com.vtb.httptest.models.ValidationOptions;

/**
 * Checks a response against the documented schema of its operation. Must not modify the response.
 */
public interface SchemaValidator {

    /**
     * @return violations found; an empty error list means the response is valid
     * @throws SchemaValidationException when validation cannot run at all
     */
    SchemaValidationResult validate(HttpResponse response, OperationDescriptor operation, ValidationOptions options)
        throws SchemaValidationException;
}
