package com.usermanagement.api.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One page of the user list, with what a client needs to request the other pages. */
public class UserPage {

    public final List<User> users;

    public final int page;

    public final int limit;

    public final int total;

    @JsonProperty("total_pages")
    public final int totalPages;

    public UserPage (List<User> users, int page, int limit, int total) {
        this.users = users;
        this.page = page;
        this.limit = limit;
        this.total = total;
        this.totalPages = (total + limit - 1) / limit;
    }

}
