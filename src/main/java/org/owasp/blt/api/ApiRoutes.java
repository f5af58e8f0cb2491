package org.owasp.blt.api;

import org.owasp.blt.api.handlers.ContributorsHandler;
import org.owasp.blt.api.handlers.DomainsHandler;
import org.owasp.blt.api.handlers.HealthHandler;
import org.owasp.blt.api.handlers.HuntsHandler;
import org.owasp.blt.api.handlers.LeaderboardHandler;
import org.owasp.blt.api.handlers.OrganizationsHandler;
import org.owasp.blt.api.handlers.ProjectsHandler;
import org.owasp.blt.api.handlers.ReposHandler;
import org.owasp.blt.api.handlers.StatsHandler;
import org.owasp.blt.api.handlers.UsersHandler;
import org.owasp.blt.api.rest.RestRouter;
import org.owasp.blt.api.services.BltClient;

/**
 * The gateway's route table. Order inside a resource group does not matter: the router ranks
 * {@code /hunts/active} ahead of {@code /hunts/{id}} on its own.
 */
public final class ApiRoutes {

    private ApiRoutes() {
    }

    public static RestRouter build(BltClient client) {
        RestRouter router = new RestRouter();
        register(router, client);
        return router;
    }

    public static void register(RestRouter router, BltClient client) {
        HealthHandler health = new HealthHandler();
        StatsHandler stats = new StatsHandler(client);
        ContributorsHandler contributors = new ContributorsHandler(client);
        HuntsHandler hunts = new HuntsHandler(client);
        LeaderboardHandler leaderboard = new LeaderboardHandler(client);
        ReposHandler repos = new ReposHandler(client);
        UsersHandler users = new UsersHandler(client);
        DomainsHandler domains = new DomainsHandler(client);
        OrganizationsHandler organizations = new OrganizationsHandler(client);
        ProjectsHandler projects = new ProjectsHandler(client);

        // --- Health ---
        router.get("/", health::health)
                .get("/health", health::health);

        // --- Users ---
        router.get("/users", users::list)
                .get("/users/{id}", users::get)
                .get("/users/{id}/profile", users::get);

        // --- Domains ---
        router.get("/domains", domains::list)
                .get("/domains/{id}", domains::get)
                .get("/domains/{id}/tags", domains::tags)
                .get("/domains/{id}/issues", domains::issues);

        // --- Organizations ---
        router.get("/organizations", organizations::list)
                .get("/organizations/{id}", organizations::get)
                .get("/organizations/{id}/repos", organizations::repos)
                .get("/organizations/{id}/projects", organizations::projects);

        // --- Projects ---
        router.get("/projects", projects::list)
                .get("/projects/{id}", projects::get)
                .get("/projects/{id}/contributors", projects::contributors);

        // --- Stats ---
        router.get("/stats", stats::stats);

        // --- Bug Hunts ---
        router.get("/hunts", hunts::list)
                .get("/hunts/{id}", hunts::get)
                .get("/hunts/active", hunts::active)
                .get("/hunts/previous", hunts::previous)
                .get("/hunts/upcoming", hunts::upcoming);

        // --- Leaderboard ---
        router.get("/leaderboard", leaderboard::global)
                .get("/leaderboard/monthly", leaderboard::monthly)
                .get("/leaderboard/organizations", leaderboard::organizations);

        // --- Contributors ---
        router.get("/contributors", contributors::list)
                .get("/contributors/{id}", contributors::get);

        // --- Repositories ---
        router.get("/repos", repos::list)
                .get("/repos/{id}", repos::get);
    }
}
