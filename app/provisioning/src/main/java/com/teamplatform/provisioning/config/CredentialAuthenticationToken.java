package com.teamplatform.provisioning.config;

import com.teamplatform.provisioning.credential.VerifiedCredential;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * 検証済み資格情報を SecurityContext に載せる。権限は {@code AUD_<audience>} と {@code ROLE_<role>} で表す。
 * トークン文字列は保持しない。
 */
public class CredentialAuthenticationToken extends AbstractAuthenticationToken {

  private final transient VerifiedCredential credential;

  public CredentialAuthenticationToken(VerifiedCredential credential) {
    super(authoritiesOf(credential));
    this.credential = credential;
    setAuthenticated(true);
  }

  public VerifiedCredential credential() {
    return credential;
  }

  @Override
  public Object getCredentials() {
    return "";
  }

  @Override
  public Object getPrincipal() {
    return credential;
  }

  @Override
  public String getName() {
    return credential.subject();
  }

  public static String audienceAuthority(String audienceName) {
    return "AUD_" + audienceName;
  }

  private static List<GrantedAuthority> authoritiesOf(VerifiedCredential credential) {
    final List<GrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(audienceAuthority(credential.audience().name())));
    for (String role : credential.roles()) {
      authorities.add(new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT)));
    }
    return authorities;
  }
}
