package com.pharmos.graphql;

import com.pharmos.domain.Project;
import com.pharmos.domain.Role;
import com.pharmos.domain.User;
import com.pharmos.query.Paginated;
import com.pharmos.query.PaginationInput;
import com.pharmos.query.Paginator;
import com.pharmos.query.SortKeys;
import com.pharmos.query.UserFilter;
import com.pharmos.security.AccessGuard;
import com.pharmos.security.Identity;
import com.pharmos.security.IdentityInterceptor;
import com.pharmos.storage.UserRepository;
import graphql.schema.DataFetchingEnvironment;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * GraphQL controller for users
 */
@Controller
public class UserController {

    private final UserRepository userRepository;
    private final Paginator paginator;
    private final AccessGuard accessGuard;

    public UserController(UserRepository userRepository, Paginator paginator, AccessGuard accessGuard) {
        this.userRepository = userRepository;
        this.paginator = paginator;
        this.accessGuard = accessGuard;
    }

    /**
     * The user behind the caller's token.
     */
    @QueryMapping
    public CompletableFuture<User> me(
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.USER_BY_ID, identity.getId());
    }

    @QueryMapping
    public CompletableFuture<User> user(
            @Argument String id,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity,
            DataFetchingEnvironment env) {
        accessGuard.requireIdentity(identity);
        return Loaders.loadOne(env, Loaders.USER_BY_ID, id);
    }

    @QueryMapping
    public Paginated<User> users(
            @Argument UserFilter filter,
            @Argument PaginationInput pagination,
            @ContextValue(name = IdentityInterceptor.IDENTITY_KEY, required = false) Identity identity) {
        accessGuard.requireRole(identity, Role.ADMIN);
        return paginator.paginate(userRepository.findAll(filter), pagination, SortKeys.USER);
    }

    @SchemaMapping(typeName = "User", field = "projects")
    public CompletableFuture<List<Project>> projects(User user, DataFetchingEnvironment env) {
        return Loaders.loadChildren(env, Loaders.PROJECTS_BY_USER_ID, user.getId());
    }
}
