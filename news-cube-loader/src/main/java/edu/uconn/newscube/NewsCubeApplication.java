package edu.uconn.newscube;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the News Cube Loader.
 *
 * This application reads the cleaned article CSV export, enriches every
 * article with taxonomy tags and organisation entities, and writes an
 * OLAP-ready star schema (fact, dimension and bridge tables) to CSV files
 * and the PostgreSQL warehouse.
 */
@SpringBootApplication
public class NewsCubeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(NewsCubeApplication.class, args)
        ));
    }
}
