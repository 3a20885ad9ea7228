package com.usermanagement.api.components;

/**
 * A marker interface for the long-lived parts of the server (the HTTP API, the gatekeeper, the task scheduler...) that
 * are wired together by hand in a Components subclass. Components are created once at startup and shared by all
 * request threads.
 */
public interface Component {

}
