package com.brick.query.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS application with OpenAPI metadata for the building query API.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Brick Knowledge Graph Query API",
                version = "1.0.0",
                description = "Answers natural-language questions about buildings by compiling them into "
                        + "Cypher over a Brick Schema knowledge graph stored in FalkorDB.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class BrickQueryApplication extends Application {
}
