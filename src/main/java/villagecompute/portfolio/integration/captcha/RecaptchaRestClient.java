/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.portfolio.integration.captcha;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;
import villagecompute.portfolio.api.types.RecaptchaVerifyResponseType;

/**
 * REST client for the reCAPTCHA verification API.
 *
 * <p>
 * The base URL is configured as {@code quarkus.rest-client.recaptcha.url}.
 *
 * <p>
 * See: https://developers.google.com/recaptcha/docs/verify
 */
@RegisterRestClient(
        configKey = "recaptcha")
@Path("/recaptcha/api")
public interface RecaptchaRestClient {

    @POST
    @Path("/siteverify")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    RecaptchaVerifyResponseType verify(@FormParam("secret") String secret, @FormParam("response") String token,
            @FormParam("remoteip") String remoteIp);
}
