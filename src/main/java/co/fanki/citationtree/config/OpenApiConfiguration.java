package co.fanki.citationtree.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Citation Tree Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Citation Tree Server API")
                        .description("""
                                Citation Tree Server - Splits a citation graph into a
                                spanning DAG plus removed cycle edges, and serves it to
                                a map client one viewport at a time.

                                ## Features
                                - **Decomposition**: Feedback arc set removal, tree/extra
                                  edge partition and topological levels
                                - **Viewport Fragments**: Nodes, tree edges and broken
                                  edges for a bounding box, paginated by degree
                                - **Enrichment**: Extra edges for a node set, tree children
                                - **Query Control**: Per-request cancellation, timeouts
                                  and statistics
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
