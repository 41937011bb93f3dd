package co.fanki.citationtree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Citation Tree Server Application.
 *
 * <p>Entry point for the service that decomposes a citation graph into an
 * acyclic tree backbone plus extra edges, and serves viewport fragments of
 * that decomposition to interactive clients.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class CitationTreeServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CitationTreeServerApplication.class, args);
    }

}
