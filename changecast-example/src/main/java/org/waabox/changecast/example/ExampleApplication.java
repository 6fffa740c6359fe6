package org.waabox.changecast.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the ChangeCast example service.
 *
 * <p>This application streams the row changes of a college management
 * database to browser clients, including:
 * <ul>
 *   <li>an H2 change-log table read by the JDBC change source</li>
 *   <li>bearer tokens configured under {@code campus.tokens}</li>
 *   <li>a server-sent events endpoint at {@code /api/realtime/stream}</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class ExampleApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(ExampleApplication.class, args);
  }
}
