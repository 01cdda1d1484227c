package com.elssolution.ammeterlab.exception;

public class CampaignNotFoundException extends AmmeterLabException {
    public CampaignNotFoundException(String campaignId) {
        super(ErrorKind.NOT_FOUND, "campaign not found: " + campaignId);
    }
}
