package io.intellixity.mosaic.mount;

/** Opaque id of an open query result held in a {@link ResultHandleTable}. */
public record ResultHandle(long id) {}
