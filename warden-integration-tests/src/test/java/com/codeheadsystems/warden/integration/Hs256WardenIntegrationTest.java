package com.codeheadsystems.warden.integration;

import com.codeheadsystems.warden.model.TokenPurpose;
import com.codeheadsystems.warden.server.secret.RotatingSecretStore;
import java.util.Map;

class Hs256WardenIntegrationTest extends AbstractWardenIntegrationTest {

  static final Map<String, String> SECRETS = Map.of(
      "WARDEN_ACCESS_SECRET", "Kq7#vR2m!Zp9@Lx4$Nw8^Hd3&Jt6*Bf5",
      "WARDEN_REFRESH_SECRET", "Gh4%Ty8!Mn2@Vb6#Rc9$Wk3^Ps7&Qe1*Zu",
      "WARDEN_VERIFICATION_SECRET", "Xo3!Fs8@Cy5#Lm1$Dw7%Pj2^Nt9&Hb4*Ka",
      "WARDEN_PASSWORD_RESET_SECRET", "Bv6@Qz1#Wr5$Ej8%Tn3^Yk7&Ug2*Im4!Ox");

  @Override
  protected String algorithm() {
    return "HS256";
  }

  @Override
  protected Map<String, String> environment() {
    return SECRETS;
  }

  @Override
  protected void rotateAccessKey(final RotatingSecretStore secretStore) {
    secretStore.rotate(TokenPurpose.ACCESS, "Rf2$Lc9#Uy4!Hq7@Sv1%Jd6^Wp3&Mz8*Gn");
  }
}
