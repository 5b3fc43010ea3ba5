package com.pharmos.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmos.domain.User;
import org.springframework.stereotype.Repository;

import java.util.Collection;

/**
 * Users. Referenced by projects as lead and team members.
 */
@Repository
public class UserRepository extends InMemoryRepository<User> {

    public UserRepository(ObjectMapper objectMapper) {
        super(objectMapper, User.class, "user");
    }

    @Override
    protected Collection<String> parentIds(User user, Relation relation) {
        throw unsupported(relation);
    }
}
