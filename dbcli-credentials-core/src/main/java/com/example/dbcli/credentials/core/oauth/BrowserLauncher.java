package com.example.dbcli.credentials.core.oauth;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.awt.Desktop;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;

/** Shows the dashboard login page to the user. */
@FunctionalInterface
public interface BrowserLauncher {

  void open(URI url);

  /**
   * Prints the URL and opens it in the desktop browser where one is available.
   *
   * @param out where the URL is printed
   * @return launcher
   */
  static BrowserLauncher desktop(final PrintStream out) {
    final var logger = System.getLogger(BrowserLauncher.class.getName());
    final var printing = printing(out);
    return url -> {
      printing.open(url);
      if (!Desktop.isDesktopSupported()
          || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
        logger.log(DEBUG, "No desktop browser available");
        return;
      }
      try {
        Desktop.getDesktop().browse(url);
      } catch (final IOException | UnsupportedOperationException e) {
        logger.log(WARNING, "Could not open the browser, open the printed URL manually", e);
      }
    };
  }

  /**
   * Only prints the URL, for headless sessions.
   *
   * @param out where the URL is printed
   * @return launcher
   */
  static BrowserLauncher printing(final PrintStream out) {
    return url -> out.println("To login, open your browser to:\n" + url);
  }
}
