package com.mailbridge.smtpapp.pipeline;

/** Externally visible reasons a protected procedure is refused. */
public enum FailureKind {

    /** The request lacks the tenant API URL. */
    BAD_REQUEST,

    /** No installation is stored for the claimed app. */
    UNAUTHENTICATED,

    /** The bearer token was rejected; the specific reason stays internal. */
    AUTHORIZATION_DENIED,

    /** The tenant's key set could not be obtained. */
    KEY_SET_UNAVAILABLE,

    /** The pipeline was misassembled: a stage ran without what an earlier stage provides. */
    INTERNAL
}
