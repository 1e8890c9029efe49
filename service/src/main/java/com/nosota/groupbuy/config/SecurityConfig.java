package com.nosota.groupbuy.config;

import com.nosota.groupbuy.api.ApiHeaders;
import com.nosota.groupbuy.service.LedgerParameters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.ProviderManager;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationProvider;
import org.springframework.security.web.authentication.preauth.RequestHeaderAuthenticationFilter;
import org.springframework.security.web.context.RequestAttributeSecurityContextRepository;

import java.util.ArrayList;
import java.util.List;

/**
 * Participant authentication.
 *
 * <p>The caller identity arrives pre-authenticated in the {@link ApiHeaders#PARTICIPANT_ID}
 * header (set by the gateway in front of the service). Every identified caller gets
 * ROLE_PARTICIPANT; configured administrators and the platform operator also get ROLE_ADMIN.
 *
 * <p>Access rules:
 * <ul>
 *   <li>/api/v1/admin/** and account deposits: ROLE_ADMIN</li>
 *   <li>other GET endpoints: open</li>
 *   <li>everything else: any identified participant</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final LedgerParameters ledgerParameters;

    public SecurityConfig(LedgerParameters ledgerParameters) {
        this.ledgerParameters = ledgerParameters;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .addFilter(participantHeaderFilter())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/api/v1/admin/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.POST, "/api/v1/accounts/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.GET, "/api/v1/**").permitAll()
                        .anyRequest().authenticated())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .build();
    }

    // Not a bean: Boot would also register it as a plain servlet filter.
    private RequestHeaderAuthenticationFilter participantHeaderFilter() {
        PreAuthenticatedAuthenticationProvider provider = new PreAuthenticatedAuthenticationProvider();
        provider.setPreAuthenticatedUserDetailsService(token -> {
            String participantId = String.valueOf(token.getPrincipal());
            if (participantId.isBlank()) {
                throw new UsernameNotFoundException("Blank participant id");
            }

            List<GrantedAuthority> authorities = new ArrayList<>();
            authorities.add(new SimpleGrantedAuthority("ROLE_PARTICIPANT"));
            if (ledgerParameters.isAdministrator(participantId)) {
                authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
            }
            return new User(participantId, "", authorities);
        });

        RequestHeaderAuthenticationFilter filter = new RequestHeaderAuthenticationFilter();
        filter.setPrincipalRequestHeader(ApiHeaders.PARTICIPANT_ID);
        filter.setExceptionIfHeaderMissing(false);
        filter.setAuthenticationManager(new ProviderManager(provider));
        filter.setSecurityContextRepository(new RequestAttributeSecurityContextRepository());
        return filter;
    }
}
