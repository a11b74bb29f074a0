package com.codeheadsystems.warden.server;

import com.codeheadsystems.warden.model.Identity;
import com.codeheadsystems.warden.model.Role;
import com.codeheadsystems.warden.server.config.WardenConfiguration;
import com.codeheadsystems.warden.server.event.RecentSecurityEvents;
import com.codeheadsystems.warden.server.event.SecurityEventPublisher;
import com.codeheadsystems.warden.server.secret.RotatingSecretStore;
import com.codeheadsystems.warden.server.secret.SigningAlgorithm;
import java.time.Clock;
import java.util.Set;

/**
 * Shared configuration and identities for unit tests.
 */
public final class WardenFixtures {

  public static final String ACCESS_SECRET = "Kq7#vR2m!Zp9@Lx4$Nw8^Hd3&Jt6*Bf5";
  public static final String REFRESH_SECRET = "Gh4%Ty8!Mn2@Vb6#Rc9$Wk3^Ps7&Qe1*Zu";
  public static final String EMAIL_SECRET = "Xo3!Fs8@Cy5#Lm1$Dw7%Pj2^Nt9&Hb4*Ka";
  public static final String RESET_SECRET = "Bv6@Qz1#Wr5$Ej8%Tn3^Yk7&Ug2*Im4!Ox";
  public static final String ROTATED_SECRET = "Rf2$Lc9#Uy4!Hq7@Sv1%Jd6^Wp3&Mz8*Gn";

  public static final Identity ALICE =
      new Identity("user-alice", "alice@example.org", Role.CUSTOMER, Set.of("orders:read", "orders:write"));
  public static final Identity BOB = new Identity("user-bob", "bob@example.org", Role.ADMIN, Set.of("*"));

  private WardenFixtures() {
  }

  public static WardenConfiguration configuration() {
    final WardenConfiguration configuration = new WardenConfiguration();
    configuration.getSecrets().getAccess().setSecret(ACCESS_SECRET);
    configuration.getSecrets().getRefresh().setSecret(REFRESH_SECRET);
    configuration.getSecrets().getEmailVerification().setSecret(EMAIL_SECRET);
    configuration.getSecrets().getPasswordReset().setSecret(RESET_SECRET);
    return configuration;
  }

  public static RotatingSecretStore secretStore(final Clock clock) {
    return RotatingSecretStore.fromConfiguration(configuration().getSecrets(), SigningAlgorithm.HS256,
        new SecurityEventPublisher(new RecentSecurityEvents(100), clock));
  }
}
