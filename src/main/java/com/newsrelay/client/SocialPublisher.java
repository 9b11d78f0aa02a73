package com.newsrelay.client;

import com.newsrelay.exception.PublishException;
import com.newsrelay.model.Destination;
import com.newsrelay.model.Item;
import com.newsrelay.model.RephrasedContent;

/**
 * Posts rewritten content to one social platform.
 */
public interface SocialPublisher {

    Destination.Platform platform();

    /**
     * @return the platform's id for the created post
     * @throws PublishException when the platform rejects the post or cannot be reached
     */
    String publish(Destination destination, RephrasedContent content, Item item);
}
